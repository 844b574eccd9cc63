package lambda.cps.transform;

import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;
import lambda.cps.runtime.NameSupply;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 高阶策略：续延是元层面的回调，在转换过程中直接调用，而不是先构造 Lambda 再应用。
 *
 * <p>函数或参数已是原子时回调就地执行，不产生管理性 redex；只有真正需要返回调用点的
 * 应用节点才会生成一个返回值续延 {@code λrv. k(rv)}。</p>
 */
public final class HigherOrderCpsTransform extends AbstractCpsTransform {

  public HigherOrderCpsTransform(NameSupply names) {
    super(names);
  }

  @Override
  public String name() {
    return "higher-order";
  }

  @Override
  protected CpsModel.CExpr lambdaBody(SourceModel.Expr body, String k) {
    CpsModel.AExpr kVar = new CpsModel.Var(k);
    return convert(body, rv -> call(kVar, rv));
  }

  /**
   * 语法续延 cont 适配为回调 {@code rv -> cont(rv)}。
   */
  @Override
  public CpsModel.CExpr convert(SourceModel.Expr expr, CpsModel.AExpr cont) {
    Objects.requireNonNull(cont, "cont");
    return convert(expr, rv -> call(cont, rv));
  }

  /**
   * T：以元续延 k 转换尾位置的源项。
   *
   * @param expr 源项
   * @param k 接收结果原子值并产出尾调用的回调，同步调用
   * @return 单个尾调用
   */
  public CpsModel.CExpr convert(SourceModel.Expr expr, Function<CpsModel.AExpr, CpsModel.CExpr> k) {
    Objects.requireNonNull(k, "k");
    if (expr instanceof SourceModel.App app) {
      String rv = names.gensym(RETURN_PREFIX);
      CpsModel.AExpr ret = new CpsModel.Lambda(List.of(rv), k.apply(new CpsModel.Var(rv)));
      return convert(app.fn(), f -> convert(app.arg(), e -> new CpsModel.App(f, List.of(e, ret))));
    }
    return k.apply(atomizeAtom((SourceModel.Atom) Objects.requireNonNull(expr, "expr")));
  }
}
