package lambda.cps.transform;

import lambda.cps.core.CpsModel;
import lambda.cps.core.SourceModel;

/**
 * CPS 转换策略的公共接口：原子化（M）与尾位置转换（T）。
 *
 * <p>三种策略在递归下降时表示“后续计算”的方式不同，但对外契约一致：输入源项，输出 CPS 项。</p>
 */
public interface CpsStrategy {

  /**
   * 策略标识，用于日志与错误消息。
   */
  String name();

  /**
   * 将原子源项转换为 CPS 原子表达式。
   *
   * @param expr 源项，必须为变量或抽象
   * @return 对应的 CPS 原子表达式
   * @throws lambda.cps.NonAtomicInputException expr 为应用节点时抛出（调用方缺陷）
   */
  CpsModel.AExpr atomize(SourceModel.Expr expr);

  /**
   * 以语法续延转换处于尾位置的源项。
   *
   * @param expr 源项
   * @param cont 已构造好的续延值（通常是变量或 Lambda）
   * @return 单个尾调用
   */
  CpsModel.CExpr convert(SourceModel.Expr expr, CpsModel.AExpr cont);
}
