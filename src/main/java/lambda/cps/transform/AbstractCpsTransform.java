package lambda.cps.transform;

import lambda.cps.NonAtomicInputException;
import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;
import lambda.cps.runtime.NameSupply;
import java.util.List;
import java.util.Objects;

/**
 * 三种策略共享的骨架：持有名字生成器，负责原子化入口的前置条件检查与变量情形。
 *
 * <p>内部递归只会以 {@link SourceModel.Atom} 调用 {@link #atomizeAtom}，前置条件检查只存在于公开入口。</p>
 */
public abstract class AbstractCpsTransform implements CpsStrategy {
  /** 续延参数前缀 */
  public static final String CONT_PREFIX = "k";
  /** 暂存函数值前缀 */
  public static final String FUNC_PREFIX = "f";
  /** 暂存参数值前缀 */
  public static final String ARG_PREFIX = "e";
  /** 返回值前缀 */
  public static final String RETURN_PREFIX = "rv";

  protected final NameSupply names;

  protected AbstractCpsTransform(NameSupply names) {
    this.names = Objects.requireNonNull(names, "names");
  }

  public NameSupply getNameSupply() {
    return names;
  }

  @Override
  public final CpsModel.AExpr atomize(SourceModel.Expr expr) {
    Objects.requireNonNull(expr, "expr");
    if (expr instanceof SourceModel.Atom atom) {
      return atomizeAtom(atom);
    }
    throw new NonAtomicInputException(name(), expr.getClass().getSimpleName());
  }

  /**
   * M：变量原样映射，抽象增加一个续延参数，函数体由各策略决定如何转换。
   */
  protected final CpsModel.AExpr atomizeAtom(SourceModel.Atom atom) {
    if (atom instanceof SourceModel.Var v) {
      return new CpsModel.Var(v.name());
    }
    SourceModel.Lam lam = (SourceModel.Lam) atom;
    String k = names.gensym(CONT_PREFIX);
    return new CpsModel.Lambda(List.of(lam.param(), k), lambdaBody(lam.body(), k));
  }

  /**
   * 转换抽象的函数体，续延为刚生成的参数 {@code k}。
   */
  protected abstract CpsModel.CExpr lambdaBody(SourceModel.Expr body, String k);

  /** 以单个参数调用 callee。 */
  protected static CpsModel.CExpr call(CpsModel.AExpr callee, CpsModel.AExpr arg) {
    return new CpsModel.App(callee, List.of(arg));
  }
}
