package lambda.cps;

import lambda.cps.analysis.CpsAnalyzer;
import lambda.cps.analysis.SourceAnalyzer;
import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;
import lambda.cps.runtime.CpsConfig;
import lambda.cps.runtime.NameSupply;
import lambda.cps.transform.CpsStrategy;
import lambda.cps.transform.HigherOrderCpsTransform;
import lambda.cps.transform.HybridCpsTransform;
import lambda.cps.transform.NaiveCpsTransform;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CPS 转换入口
 * <p>
 * 将无类型 lambda 演算源项转换为 CPS 项。
 * <p>
 * 转换流程：
 * <pre>
 * 源项 → 收集已有名字（保留集） → 私有 NameSupply → 策略递归下降 → CPS 项
 * </pre>
 * <p>
 * 每次调用使用独立的名字生成器，计数器从 0 开始，生成的名字与输入项及续延中的名字互不冲突。
 * 需要跨多次转换共享计数器时，使用 {@link #convert(Strategy, SourceModel.Expr, CpsModel.AExpr, NameSupply)}。
 * <p>
 * 原子化入口（{@code atomize*}）只接受变量或抽象，传入应用节点违反前置条件，抛出
 * {@link NonAtomicInputException}。
 * <p>
 * 三种策略都按源项结构递归，调用栈深度与应用链长度成正比。默认线程栈下数万层嵌套的应用链会抛出
 * {@link StackOverflowError}，需要转换此类输入时在栈更大的线程中调用。
 */
public final class CpsConverter {

  private static final Logger LOGGER = Logger.getLogger(CpsConverter.class.getName());

  private static final String FALLBACK_HALT = "halt";

  private static final Strategy DEFAULT_STRATEGY = resolveStrategy(CpsConfig.DEFAULT_STRATEGY_ID);

  private CpsConverter() {
    // 工具类，禁止实例化
  }

  /**
   * 朴素策略转换（T），调用方提供顶层续延（如 halt 变量）。
   */
  public static CpsModel.CExpr convertNaive(SourceModel.Expr expr, CpsModel.AExpr cont) {
    return convert(Strategy.NAIVE, expr, cont);
  }

  /**
   * 高阶策略转换（T），顶层续延为元层回调。
   * <p>
   * 回调产出的项中的名字不会被预留，调用方应避免使用 {@code k}、{@code rv} 加数字形式的名字。
   */
  public static CpsModel.CExpr convertHigherOrder(SourceModel.Expr expr, Function<CpsModel.AExpr, CpsModel.CExpr> k) {
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(k, "k");
    HigherOrderCpsTransform transform = new HigherOrderCpsTransform(supplyFor(expr, null));
    return trace(transform, transform.convert(expr, k));
  }

  /**
   * 混合策略转换（Tc），调用方提供顶层续延。
   */
  public static CpsModel.CExpr convertHybrid(SourceModel.Expr expr, CpsModel.AExpr cont) {
    return convert(Strategy.HYBRID, expr, cont);
  }

  /**
   * 朴素策略原子化（M）。
   *
   * @param expr 变量或抽象
   * @throws NonAtomicInputException expr 为应用节点时抛出
   */
  public static CpsModel.AExpr atomizeNaive(SourceModel.Expr expr) {
    return new NaiveCpsTransform(supplyFor(expr, null)).atomize(expr);
  }

  /**
   * 高阶策略原子化（M）。
   *
   * @param expr 变量或抽象
   * @throws NonAtomicInputException expr 为应用节点时抛出
   */
  public static CpsModel.AExpr atomizeHigherOrder(SourceModel.Expr expr) {
    return new HigherOrderCpsTransform(supplyFor(expr, null)).atomize(expr);
  }

  /**
   * 混合策略原子化（M）。
   *
   * @param expr 变量或抽象
   * @throws NonAtomicInputException expr 为应用节点时抛出
   */
  public static CpsModel.AExpr atomizeHybrid(SourceModel.Expr expr) {
    return new HybridCpsTransform(supplyFor(expr, null)).atomize(expr);
  }

  /**
   * 使用默认策略与配置的 halt 变量转换。
   */
  public static CpsModel.CExpr convert(SourceModel.Expr expr) {
    return convert(defaultStrategy(), expr);
  }

  /**
   * 使用指定策略，以配置的 halt 变量（LAMBDA_CPS_HALT）作为顶层续延转换。
   */
  public static CpsModel.CExpr convert(Strategy strategy, SourceModel.Expr expr) {
    return convert(strategy, expr, new CpsModel.Var(haltName()));
  }

  public static CpsModel.CExpr convert(Strategy strategy, SourceModel.Expr expr, CpsModel.AExpr cont) {
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(cont, "cont");
    return convert(strategy, expr, cont, supplyFor(expr, cont));
  }

  /**
   * 使用调用方提供的名字生成器转换，多次调用共享同一计数器。
   * <p>
   * 转换前把 expr 与 cont 中的名字追加为 names 的保留名。
   */
  public static CpsModel.CExpr convert(Strategy strategy, SourceModel.Expr expr, CpsModel.AExpr cont, NameSupply names) {
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(cont, "cont");
    Objects.requireNonNull(names, "names");
    names.reserve(SourceAnalyzer.names(expr));
    names.reserve(CpsAnalyzer.names(cont));
    CpsStrategy transform = strategy.create(names);
    return trace(transform, transform.convert(expr, cont));
  }

  /**
   * 用全部策略转换同一源项并返回各自的规模指标，按策略声明顺序排列。
   */
  public static Map<Strategy, CpsAnalyzer.Metrics> compare(SourceModel.Expr expr) {
    Objects.requireNonNull(expr, "expr");
    CpsModel.AExpr halt = new CpsModel.Var(haltName());
    Map<Strategy, CpsAnalyzer.Metrics> result = new EnumMap<>(Strategy.class);
    for (Strategy strategy : Strategy.values()) {
      CpsModel.CExpr out = strategy.create(supplyFor(expr, halt)).convert(expr, halt);
      result.put(strategy, CpsAnalyzer.metrics(out));
    }
    LOGGER.log(Level.FINE, "策略对比 size={0}: {1}", new Object[]{SourceAnalyzer.size(expr), result});
    return Collections.unmodifiableMap(result);
  }

  /**
   * LAMBDA_CPS_STRATEGY 配置的策略，类加载时解析一次，无法识别时为 hybrid。
   */
  public static Strategy defaultStrategy() {
    return DEFAULT_STRATEGY;
  }

  static Strategy resolveStrategy(String id) {
    try {
      return Strategy.fromId(id);
    } catch (IllegalArgumentException e) {
      LOGGER.log(Level.WARNING, "策略配置 ''{0}'' 无效，使用 hybrid", id);
      return Strategy.HYBRID;
    }
  }

  static String haltName() {
    String configured = CpsConfig.HALT_NAME;
    if (configured == null || configured.isBlank()) {
      LOGGER.log(Level.WARNING, "LAMBDA_CPS_HALT 为空，使用 {0}", FALLBACK_HALT);
      return FALLBACK_HALT;
    }
    return configured.strip();
  }

  /**
   * 为一次转换创建私有名字生成器，预留输入项与续延中的全部名字。
   */
  static NameSupply supplyFor(SourceModel.Expr expr, CpsModel.AExpr cont) {
    Set<String> reserved = new LinkedHashSet<>(SourceAnalyzer.names(Objects.requireNonNull(expr, "expr")));
    if (cont != null) {
      reserved.addAll(CpsAnalyzer.names(cont));
    }
    return new NameSupply(reserved);
  }

  private static CpsModel.CExpr trace(CpsStrategy transform, CpsModel.CExpr out) {
    Level level = CpsConfig.DEBUG ? Level.INFO : Level.FINE;
    if (LOGGER.isLoggable(level)) {
      LOGGER.log(level, "{0} 转换完成: {1}", new Object[]{transform.name(), CpsAnalyzer.metrics(out)});
    }
    return out;
  }
}
