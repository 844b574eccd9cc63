package lambda.cps.analysis;

import lambda.cps.core.CpsModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CPS 项的只读分析：规模统计、管理性 redex 计数、名字收集与 alpha 等价判定。
 *
 * <p>所有方法只遍历不改写，用于比较不同策略的输出。</p>
 */
public final class CpsAnalyzer {

  private CpsAnalyzer() {}

  /**
   * 输出规模指标。
   *
   * @param nodes 节点总数（原子与复杂表达式）
   * @param lambdas Lambda 数量
   * @param calls 尾调用数量
   * @param redexes 被调方为 Lambda 的调用数量，即可立即归约的 redex
   */
  public record Metrics(int nodes, int lambdas, int calls, int redexes) {}

  public static Metrics metrics(CpsModel.CExpr term) {
    int[] acc = new int[4];
    countC(term, acc);
    return new Metrics(acc[0], acc[1], acc[2], acc[3]);
  }

  public static Metrics metrics(CpsModel.AExpr term) {
    int[] acc = new int[4];
    countA(term, acc);
    return new Metrics(acc[0], acc[1], acc[2], acc[3]);
  }

  private static void countC(CpsModel.CExpr term, int[] acc) {
    CpsModel.App app = (CpsModel.App) term;
    acc[0]++;
    acc[2]++;
    if (app.callee() instanceof CpsModel.Lambda) acc[3]++;
    countA(app.callee(), acc);
    for (CpsModel.AExpr a : app.args()) countA(a, acc);
  }

  private static void countA(CpsModel.AExpr term, int[] acc) {
    acc[0]++;
    if (term instanceof CpsModel.Lambda lambda) {
      acc[1]++;
      countC(lambda.body(), acc);
    }
  }

  /**
   * 所有 Lambda 参数，按出现顺序（可重复）。
   */
  public static List<String> binders(CpsModel.CExpr term) {
    List<String> out = new ArrayList<>();
    collectBinders(term, out);
    return out;
  }

  public static List<String> binders(CpsModel.AExpr term) {
    List<String> out = new ArrayList<>();
    collectBinders(term, out);
    return out;
  }

  private static void collectBinders(CpsModel.CExpr term, List<String> out) {
    CpsModel.App app = (CpsModel.App) term;
    collectBinders(app.callee(), out);
    for (CpsModel.AExpr a : app.args()) collectBinders(a, out);
  }

  private static void collectBinders(CpsModel.AExpr term, List<String> out) {
    if (term instanceof CpsModel.Lambda lambda) {
      out.addAll(lambda.params());
      collectBinders(lambda.body(), out);
    }
  }

  /**
   * 出现过的全部名字（绑定与引用）。
   */
  public static Set<String> names(CpsModel.CExpr term) {
    Set<String> out = new LinkedHashSet<>(binders(term));
    collectFree(term, Set.of(), out, true);
    return out;
  }

  public static Set<String> names(CpsModel.AExpr term) {
    Set<String> out = new LinkedHashSet<>(binders(term));
    collectFree(term, Set.of(), out, true);
    return out;
  }

  public static Set<String> freeVariables(CpsModel.CExpr term) {
    Set<String> out = new LinkedHashSet<>();
    collectFree(term, Set.of(), out, false);
    return out;
  }

  public static Set<String> freeVariables(CpsModel.AExpr term) {
    Set<String> out = new LinkedHashSet<>();
    collectFree(term, Set.of(), out, false);
    return out;
  }

  private static void collectFree(CpsModel.CExpr term, Set<String> bound, Set<String> out, boolean all) {
    CpsModel.App app = (CpsModel.App) term;
    collectFree(app.callee(), bound, out, all);
    for (CpsModel.AExpr a : app.args()) collectFree(a, bound, out, all);
  }

  private static void collectFree(CpsModel.AExpr term, Set<String> bound, Set<String> out, boolean all) {
    if (term instanceof CpsModel.Var v) {
      if (all || !bound.contains(v.name())) out.add(v.name());
    } else if (term instanceof CpsModel.Lambda lambda) {
      Set<String> inner = new HashSet<>(bound);
      inner.addAll(lambda.params());
      collectFree(lambda.body(), inner, out, all);
    }
  }

  /**
   * alpha 等价：忽略绑定变量的一致重命名，自由变量按名字比较。
   */
  public static boolean alphaEquivalent(CpsModel.CExpr a, CpsModel.CExpr b) {
    return new AlphaComparator().equalC(a, b, Map.of(), Map.of());
  }

  public static boolean alphaEquivalent(CpsModel.AExpr a, CpsModel.AExpr b) {
    return new AlphaComparator().equalA(a, b, Map.of(), Map.of());
  }

  /**
   * 两侧绑定名映射到同一序号即视为同一变量。
   */
  private static final class AlphaComparator {
    private int nextIndex = 0;

    boolean equalC(CpsModel.CExpr a, CpsModel.CExpr b, Map<String, Integer> left, Map<String, Integer> right) {
      CpsModel.App x = (CpsModel.App) a;
      CpsModel.App y = (CpsModel.App) b;
      if (x.args().size() != y.args().size()) return false;
      if (!equalA(x.callee(), y.callee(), left, right)) return false;
      for (int i = 0; i < x.args().size(); i++) {
        if (!equalA(x.args().get(i), y.args().get(i), left, right)) return false;
      }
      return true;
    }

    boolean equalA(CpsModel.AExpr a, CpsModel.AExpr b, Map<String, Integer> left, Map<String, Integer> right) {
      if (a instanceof CpsModel.Var x && b instanceof CpsModel.Var y) {
        Integer li = left.get(x.name());
        Integer ri = right.get(y.name());
        if (li == null && ri == null) return x.name().equals(y.name());
        return li != null && li.equals(ri);
      }
      if (a instanceof CpsModel.Lambda x && b instanceof CpsModel.Lambda y) {
        if (x.params().size() != y.params().size()) return false;
        Map<String, Integer> innerLeft = new HashMap<>(left);
        Map<String, Integer> innerRight = new HashMap<>(right);
        for (int i = 0; i < x.params().size(); i++) {
          int index = nextIndex++;
          innerLeft.put(x.params().get(i), index);
          innerRight.put(y.params().get(i), index);
        }
        return equalC(x.body(), y.body(), innerLeft, innerRight);
      }
      return false;
    }
  }
}
