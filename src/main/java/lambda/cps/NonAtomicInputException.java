package lambda.cps;

import lambda.cps.runtime.ErrorMessages;

/**
 * 原子化入口收到应用节点时抛出。
 *
 * <p>源语言只有三种形式，正确的调用方只会对变量或抽象调用原子化，因此该异常表示调用方缺陷，而非输入数据损坏。</p>
 */
public class NonAtomicInputException extends IllegalArgumentException {
  private final String strategy;

  public NonAtomicInputException(String strategy, String kind) {
    super(ErrorMessages.nonAtomicInput(strategy, kind));
    this.strategy = strategy;
  }

  public String getStrategy() {
    return strategy;
  }
}
