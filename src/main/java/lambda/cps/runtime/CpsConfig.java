package lambda.cps.runtime;

/**
 * CPS 转换配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，转换过程中不再访问 System.getenv。
 */
public final class CpsConfig {
  private CpsConfig() {}

  /**
   * 调试模式开关
   * 环境变量：LAMBDA_CPS_DEBUG
   * 启用时每次转换都会以 INFO 级别记录策略与输出规模
   */
  public static final boolean DEBUG = System.getenv("LAMBDA_CPS_DEBUG") != null;

  /**
   * 默认转换策略标识
   * 环境变量：LAMBDA_CPS_STRATEGY
   * 可选 naive / higher-order / hybrid，未指定时为 "hybrid"
   */
  public static final String DEFAULT_STRATEGY_ID = getEnvOrDefault("LAMBDA_CPS_STRATEGY", "hybrid");

  /**
   * 顶层续延变量名
   * 环境变量：LAMBDA_CPS_HALT
   * 如果未指定，默认为 "halt"
   */
  public static final String HALT_NAME = getEnvOrDefault("LAMBDA_CPS_HALT", "halt");

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }
}
