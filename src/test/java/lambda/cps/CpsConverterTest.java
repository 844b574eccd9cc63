package lambda.cps;

import lambda.cps.analysis.CpsAnalyzer;
import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;
import lambda.cps.runtime.CpsConfig;
import lambda.cps.runtime.NameSupply;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static lambda.cps.TermFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * CpsConverter 入口测试
 * <p>
 * 覆盖三组 convert/atomize 入口、名字预留、共享计数器与策略对比。
 */
public class CpsConverterTest {

  private static final CpsModel.AExpr IDENTITY_CPS = clam(List.of("x", "k0"), call(cv("k0"), cv("x")));

  // ============================================================
  // 原子化入口
  // ============================================================

  @Test
  public void testAtomizeVariableWithEveryStrategy() {
    assertEquals(cv("x"), CpsConverter.atomizeNaive(v("x")));
    assertEquals(cv("x"), CpsConverter.atomizeHigherOrder(v("x")));
    assertEquals(cv("x"), CpsConverter.atomizeHybrid(v("x")));
  }

  @Test
  public void testAtomizeIdentityWithEveryStrategy() {
    SourceModel.Expr id = lam("x", v("x"));

    assertEquals(IDENTITY_CPS, CpsConverter.atomizeNaive(id));
    assertEquals(IDENTITY_CPS, CpsConverter.atomizeHigherOrder(id));
    assertEquals(IDENTITY_CPS, CpsConverter.atomizeHybrid(id));
  }

  @Test
  public void testAtomizeApplicationIsPreconditionViolation() {
    SourceModel.Expr app = ap(v("f"), v("x"));

    assertThrows(NonAtomicInputException.class, () -> CpsConverter.atomizeNaive(app));
    assertThrows(NonAtomicInputException.class, () -> CpsConverter.atomizeHigherOrder(app));
    NonAtomicInputException e = assertThrows(NonAtomicInputException.class, () -> CpsConverter.atomizeHybrid(app));
    assertInstanceOf(IllegalArgumentException.class, e);
  }

  // ============================================================
  // 转换入口
  // ============================================================

  @Test
  public void testConvertIdentityWithEveryStrategy() {
    SourceModel.Expr id = lam("x", v("x"));
    CpsModel.CExpr expected = call(cv("halt"), IDENTITY_CPS);

    assertEquals(expected, CpsConverter.convertNaive(id, cv("halt")));
    assertEquals(expected, CpsConverter.convertHigherOrder(id, rv -> call(cv("halt"), rv)));
    assertEquals(expected, CpsConverter.convertHybrid(id, cv("halt")));
  }

  @Test
  public void testHigherOrderApplicationOfAtoms() {
    CpsModel.CExpr out = CpsConverter.convertHigherOrder(ap(v("f"), v("x")), rv -> call(cv("halt"), rv));

    assertEquals(call(cv("f"), cv("x"), clam(List.of("rv0"), call(cv("halt"), cv("rv0")))), out);
  }

  /**
   * 测试：朴素策略把 halt 包进两个只用一次的 Lambda，规模严格大于高阶策略。
   */
  @Test
  public void testNaiveIsStrictlyLargerThanHigherOrder() {
    SourceModel.Expr app = ap(v("f"), v("x"));
    CpsModel.CExpr naive = CpsConverter.convertNaive(app, cv("halt"));
    CpsModel.CExpr higherOrder = CpsConverter.convertHigherOrder(app, rv -> call(cv("halt"), rv));

    CpsModel.CExpr expected = call(
        clam(List.of("f0"), call(clam(List.of("e1"), call(cv("f0"), cv("e1"), cv("halt"))), cv("x"))),
        cv("f"));
    assertEquals(expected, naive);
    assertTrue(CpsAnalyzer.metrics(naive).nodes() > CpsAnalyzer.metrics(higherOrder).nodes());
    assertEquals(2, CpsAnalyzer.metrics(naive).redexes());
    assertEquals(0, CpsAnalyzer.metrics(higherOrder).redexes());
  }

  /**
   * 测试：输入中已有 k0、rv0 时生成的名字跳过它们。
   */
  @Test
  public void testGeneratedNamesAvoidInputNames() {
    CpsModel.AExpr out = CpsConverter.atomizeHybrid(lam("k0", v("k0")));
    assertEquals(clam(List.of("k0", "k1"), call(cv("k1"), cv("k0"))), out);

    CpsModel.CExpr ho = CpsConverter.convert(Strategy.HIGHER_ORDER, ap(v("rv0"), v("x")), cv("halt"));
    assertEquals(call(cv("rv0"), cv("x"), clam(List.of("rv1"), call(cv("halt"), cv("rv1")))), ho);
  }

  @Test
  public void testGeneratedNamesAvoidContinuationNames() {
    CpsModel.AExpr cont = clam(List.of("rv0"), call(cv("done"), cv("rv0")));
    CpsModel.CExpr out = CpsConverter.convert(Strategy.HIGHER_ORDER, ap(v("f"), v("x")), cont);

    assertEquals(List.of("rv1", "rv0"), CpsAnalyzer.binders(out), "续延中的 rv0 不应被重复生成");
  }

  @Test
  public void testSharedSupplyContinuesCounting() {
    NameSupply names = new NameSupply();
    SourceModel.Expr id = lam("x", v("x"));

    CpsModel.CExpr first = CpsConverter.convert(Strategy.HYBRID, id, cv("halt"), names);
    CpsModel.CExpr second = CpsConverter.convert(Strategy.HYBRID, id, cv("halt"), names);

    assertEquals(call(cv("halt"), IDENTITY_CPS), first);
    assertEquals(call(cv("halt"), clam(List.of("x", "k1"), call(cv("k1"), cv("x")))), second);
    assertEquals(2, names.nextIndex());
  }

  /**
   * 测试：共享生成器同样预留输入项与续延中的名字，不会捕获用户绑定。
   */
  @Test
  public void testSharedSupplyReservesInputNames() {
    NameSupply names = new NameSupply();

    CpsModel.CExpr out = CpsConverter.convert(Strategy.HYBRID, lam("k0", v("k0")), cv("halt"), names);
    assertEquals(call(cv("halt"), clam(List.of("k0", "k1"), call(cv("k1"), cv("k0")))), out);

    CpsModel.AExpr cont = clam(List.of("k2"), call(cv("done"), cv("k2")));
    CpsModel.CExpr next = CpsConverter.convert(Strategy.NAIVE, lam("x", v("x")), cont, names);
    assertEquals(call(cont, clam(List.of("x", "k3"), call(cv("k3"), cv("x")))), next);
    assertTrue(names.reserved().containsAll(List.of("k0", "halt", "x", "k2", "done")));
  }

  @Test
  public void testConvertWithConfiguredHalt() {
    assumeTrue(System.getenv("LAMBDA_CPS_HALT") == null);

    CpsModel.CExpr out = CpsConverter.convert(Strategy.HYBRID, ap(v("f"), v("x")));
    assertEquals(call(cv("f"), cv("x"), cv(CpsConfig.HALT_NAME)), out);
    assertEquals("halt", CpsConfig.HALT_NAME);
  }

  @Test
  public void testDefaultStrategyIsHybrid() {
    assumeTrue(System.getenv("LAMBDA_CPS_STRATEGY") == null);

    assertEquals(Strategy.HYBRID, CpsConverter.defaultStrategy());
    assertEquals(CpsConverter.convert(Strategy.HYBRID, ap(v("f"), v("x"))), CpsConverter.convert(ap(v("f"), v("x"))));
  }

  @Test
  public void testUnknownStrategyConfigFallsBackToHybrid() {
    assertEquals(Strategy.HYBRID, CpsConverter.resolveStrategy("fast"));
    assertEquals(Strategy.HYBRID, CpsConverter.resolveStrategy(null));
    assertEquals(Strategy.NAIVE, CpsConverter.resolveStrategy("Naive"));
    assertSame(CpsConverter.defaultStrategy(), CpsConverter.defaultStrategy());
  }

  @Test
  public void testNullArgumentsRejected() {
    assertThrows(NullPointerException.class, () -> CpsConverter.convertNaive(null, cv("halt")));
    assertThrows(NullPointerException.class, () -> CpsConverter.convertHybrid(v("x"), null));
    assertThrows(NullPointerException.class, () -> CpsConverter.convertHigherOrder(v("x"), null));
    assertThrows(NullPointerException.class, () -> CpsConverter.atomizeNaive(null));
  }

  // ============================================================
  // 策略对比
  // ============================================================

  @Test
  public void testCompareReportsEveryStrategyInOrder() {
    Map<Strategy, CpsAnalyzer.Metrics> report = CpsConverter.compare(ap(ap(v("f"), v("x")), v("y")));

    assertEquals(List.of(Strategy.NAIVE, Strategy.HIGHER_ORDER, Strategy.HYBRID), List.copyOf(report.keySet()));
    assertEquals(new CpsAnalyzer.Metrics(17, 4, 5, 3), report.get(Strategy.NAIVE));
    assertEquals(new CpsAnalyzer.Metrics(11, 2, 3, 0), report.get(Strategy.HIGHER_ORDER));
    assertEquals(new CpsAnalyzer.Metrics(8, 1, 2, 0), report.get(Strategy.HYBRID));
    assertThrows(UnsupportedOperationException.class, () -> report.put(Strategy.NAIVE, null));
  }
}
