package lambda.cps.transform;

import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;
import lambda.cps.runtime.NameSupply;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 混合策略：按调用点是否已持有语法续延选择转换方式。
 *
 * <ul>
 *   <li>{@link #convert(SourceModel.Expr, CpsModel.AExpr)}（Tc）：续延已是 CPS 值，直接复用，不再包装。</li>
 *   <li>{@link #convertMeta}（Tk）：续延尚未确定，以回调表示，行为同高阶策略。</li>
 * </ul>
 *
 * <p>抽象的函数体以 {@code Tc(body, k)} 转换，嵌套应用的输出与高阶策略一样紧凑，同时省去了
 * 顶层续延的 eta 展开。</p>
 */
public final class HybridCpsTransform extends AbstractCpsTransform {

  public HybridCpsTransform(NameSupply names) {
    super(names);
  }

  @Override
  public String name() {
    return "hybrid";
  }

  @Override
  protected CpsModel.CExpr lambdaBody(SourceModel.Expr body, String k) {
    return convert(body, new CpsModel.Var(k));
  }

  /**
   * Tc：以语法续延转换尾位置的源项。
   */
  @Override
  public CpsModel.CExpr convert(SourceModel.Expr expr, CpsModel.AExpr cont) {
    Objects.requireNonNull(cont, "cont");
    if (expr instanceof SourceModel.App app) {
      return convertMeta(app.fn(), f -> convertMeta(app.arg(), e -> new CpsModel.App(f, List.of(e, cont))));
    }
    return call(cont, atomizeAtom((SourceModel.Atom) Objects.requireNonNull(expr, "expr")));
  }

  /**
   * Tk：以元续延转换源项。
   */
  public CpsModel.CExpr convertMeta(SourceModel.Expr expr, Function<CpsModel.AExpr, CpsModel.CExpr> k) {
    Objects.requireNonNull(k, "k");
    if (expr instanceof SourceModel.App app) {
      String rv = names.gensym(RETURN_PREFIX);
      CpsModel.AExpr ret = new CpsModel.Lambda(List.of(rv), k.apply(new CpsModel.Var(rv)));
      return convertMeta(app.fn(), f -> convertMeta(app.arg(), e -> new CpsModel.App(f, List.of(e, ret))));
    }
    return k.apply(atomizeAtom((SourceModel.Atom) Objects.requireNonNull(expr, "expr")));
  }
}
