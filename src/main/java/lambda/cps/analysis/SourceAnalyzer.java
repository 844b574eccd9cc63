package lambda.cps.analysis;

import lambda.cps.core.SourceModel;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 源项的只读分析：名字收集、自由变量与规模。
 */
public final class SourceAnalyzer {

  private SourceAnalyzer() {}

  /**
   * 收集项中出现的全部标识符（绑定与自由），按首次出现顺序。
   */
  public static Set<String> names(SourceModel.Expr expr) {
    Set<String> out = new LinkedHashSet<>();
    collectNames(expr, out);
    return out;
  }

  private static void collectNames(SourceModel.Expr expr, Set<String> out) {
    if (expr instanceof SourceModel.Var v) {
      out.add(v.name());
    } else if (expr instanceof SourceModel.App app) {
      collectNames(app.fn(), out);
      collectNames(app.arg(), out);
    } else if (expr instanceof SourceModel.Lam lam) {
      out.add(lam.param());
      collectNames(lam.body(), out);
    }
  }

  /**
   * 自由变量集合，按首次出现顺序。
   */
  public static Set<String> freeVariables(SourceModel.Expr expr) {
    Set<String> out = new LinkedHashSet<>();
    collectFree(expr, new HashSet<>(), out);
    return out;
  }

  private static void collectFree(SourceModel.Expr expr, Set<String> bound, Set<String> out) {
    if (expr instanceof SourceModel.Var v) {
      if (!bound.contains(v.name())) out.add(v.name());
    } else if (expr instanceof SourceModel.App app) {
      collectFree(app.fn(), bound, out);
      collectFree(app.arg(), bound, out);
    } else if (expr instanceof SourceModel.Lam lam) {
      // 内层同名绑定遮蔽外层，离开时只有新加入的名字需要移除
      boolean added = bound.add(lam.param());
      collectFree(lam.body(), bound, out);
      if (added) bound.remove(lam.param());
    }
  }

  public static boolean isClosed(SourceModel.Expr expr) {
    return freeVariables(expr).isEmpty();
  }

  /**
   * 节点总数。
   */
  public static int size(SourceModel.Expr expr) {
    if (expr instanceof SourceModel.App app) {
      return 1 + size(app.fn()) + size(app.arg());
    }
    if (expr instanceof SourceModel.Lam lam) {
      return 1 + size(lam.body());
    }
    return 1;
  }
}
