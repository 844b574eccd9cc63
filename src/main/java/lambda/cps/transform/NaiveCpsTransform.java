package lambda.cps.transform;

import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;
import lambda.cps.runtime.NameSupply;
import java.util.List;
import java.util.Objects;

/**
 * 朴素策略：续延始终是语法层面的 CPS 值。
 *
 * <p>每个应用节点都会构造两个只用一次的续延 Lambda（暂存函数值与参数值），
 * 即使函数与参数本身已是变量，输出中也会出现两个管理性 redex。</p>
 */
public final class NaiveCpsTransform extends AbstractCpsTransform {

  public NaiveCpsTransform(NameSupply names) {
    super(names);
  }

  @Override
  public String name() {
    return "naive";
  }

  @Override
  protected CpsModel.CExpr lambdaBody(SourceModel.Expr body, String k) {
    return convert(body, new CpsModel.Var(k));
  }

  /**
   * T：应用节点先对函数求值，再对参数求值，最后以 cont 作为续延发起调用。
   */
  @Override
  public CpsModel.CExpr convert(SourceModel.Expr expr, CpsModel.AExpr cont) {
    Objects.requireNonNull(cont, "cont");
    if (expr instanceof SourceModel.App app) {
      String f = names.gensym(FUNC_PREFIX);
      String e = names.gensym(ARG_PREFIX);
      CpsModel.CExpr invoke = new CpsModel.App(
          new CpsModel.Var(f), List.of(new CpsModel.Var(e), cont));
      CpsModel.AExpr argCont = new CpsModel.Lambda(List.of(e), invoke);
      CpsModel.AExpr fnCont = new CpsModel.Lambda(List.of(f), convert(app.arg(), argCont));
      return convert(app.fn(), fnCont);
    }
    return call(cont, atomizeAtom((SourceModel.Atom) Objects.requireNonNull(expr, "expr")));
  }
}
