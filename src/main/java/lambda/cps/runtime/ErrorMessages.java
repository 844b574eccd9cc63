package lambda.cps.runtime;

/**
 * CPS 转换的错误消息：原子化前置条件、策略标识与名字前缀。
 *
 * <p>格式为“中文 (English)”加一行双语提示，英文部分是测试匹配的关键字。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /** 中文在前，英文关键字放在括号内。 */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /** 另起一行追加双语恢复提示。 */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * 构造原子化输入非原子的错误消息。
   *
   * @param strategy 触发错误的转换策略名称
   * @param kind 实际收到的节点种类
   * @return 带有恢复建议的错误描述
   */
  public static String nonAtomicInput(String strategy, String kind) {
    String english = strategy + ": atomize requires Var or Lam, got " + kind;
    String message = bilingual("策略 " + strategy + " 的原子化只接受变量或抽象，实际为 " + kind, english);
    return withHint(message, "对应用节点请改用 convert 并提供续延", "Use convert with a continuation for applications");
  }

  /**
   * 构造未知转换策略的错误消息。
   *
   * @param id 无法识别的策略标识
   * @return 带有恢复建议的错误描述
   */
  public static String unknownStrategy(String id) {
    String english = "unknown CPS strategy: " + id;
    String message = bilingual("未知的 CPS 转换策略：" + id, english);
    return withHint(message, "可选值为 naive、higher-order、hybrid", "Valid ids are naive, higher-order, hybrid");
  }

  /**
   * 构造名字前缀非法的错误消息。
   *
   * @param prefix 调用方传入的前缀
   * @return 带有恢复建议的错误描述
   */
  public static String invalidNamePrefix(String prefix) {
    String english = "name prefix must not be empty or end with a digit: '" + prefix + "'";
    String message = bilingual("名字前缀不能为空或以数字结尾：'" + prefix + "'", english);
    return withHint(message, "选择以字母结尾的前缀，如 k、rv", "Pick a prefix ending in a letter, such as k or rv");
  }
}
