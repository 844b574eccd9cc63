package lambda.cps;

import lambda.cps.runtime.ErrorMessages;
import lambda.cps.runtime.NameSupply;
import lambda.cps.transform.CpsStrategy;
import lambda.cps.transform.HigherOrderCpsTransform;
import lambda.cps.transform.HybridCpsTransform;
import lambda.cps.transform.NaiveCpsTransform;
import java.util.Locale;

/**
 * 可选的 CPS 转换策略。三者语义等价，仅输出规模不同。
 */
public enum Strategy {
  NAIVE("naive") {
    @Override
    public CpsStrategy create(NameSupply names) {
      return new NaiveCpsTransform(names);
    }
  },
  HIGHER_ORDER("higher-order") {
    @Override
    public CpsStrategy create(NameSupply names) {
      return new HigherOrderCpsTransform(names);
    }
  },
  HYBRID("hybrid") {
    @Override
    public CpsStrategy create(NameSupply names) {
      return new HybridCpsTransform(names);
    }
  };

  private final String id;

  Strategy(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /**
   * 创建绑定到给定名字生成器的策略实例。
   */
  public abstract CpsStrategy create(NameSupply names);

  /**
   * 根据标识解析策略
   * <p>
   * 大小写不敏感，下划线与连字符互通：higher_order = HIGHER-ORDER = higher-order。
   *
   * @param id 策略标识
   * @return 对应策略
   * @throws IllegalArgumentException 标识未知时抛出
   */
  public static Strategy fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (Strategy s : values()) {
        if (s.id.equals(normalized)) {
          return s;
        }
      }
    }
    throw new IllegalArgumentException(ErrorMessages.unknownStrategy(id));
  }
}
