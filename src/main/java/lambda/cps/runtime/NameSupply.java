package lambda.cps.runtime;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 新鲜名字生成器（gensym）。
 *
 * <p>每个实例持有一个单调递增计数器，从 0 开始，格式为 "&lt;prefix&gt;&lt;seq&gt;"。
 * 前缀不能以数字结尾，因此同一实例发放的名字不会重复；计数器使用 AtomicLong，多个线程共享同一实例时同样成立。</p>
 *
 * <p>保留名（通常是输入项中已出现的标识符）不会被生成：命中保留名时跳过该序号继续递增。
 * 跨多次转换共享实例时，每次转换前通过 {@link #reserve(Collection)} 追加本次输入的名字。</p>
 */
public final class NameSupply {
  private final AtomicLong counter = new AtomicLong(0);
  private final Set<String> reserved = ConcurrentHashMap.newKeySet();

  public NameSupply() {
  }

  /**
   * @param reserved 不允许生成的名字集合
   */
  public NameSupply(Collection<String> reserved) {
    reserve(reserved);
  }

  /**
   * 追加保留名，之后的 {@link #gensym(String)} 不会再返回这些名字。
   */
  public void reserve(Collection<String> names) {
    reserved.addAll(Objects.requireNonNull(names, "names"));
  }

  /**
   * 生成新鲜名字：返回前缀与当前计数值的拼接，然后递增计数器。
   *
   * @param prefix 名字前缀，不能为空且不能以数字结尾
   * @return 本实例从未发放过、且不在保留集合中的名字
   * @throws IllegalArgumentException 前缀非法时抛出
   */
  public String gensym(String prefix) {
    if (prefix == null || prefix.isEmpty() || Character.isDigit(prefix.charAt(prefix.length() - 1))) {
      throw new IllegalArgumentException(ErrorMessages.invalidNamePrefix(prefix));
    }
    while (true) {
      String candidate = prefix + counter.getAndIncrement();
      if (!reserved.contains(candidate)) {
        return candidate;
      }
    }
  }

  /**
   * 下一个将被尝试的计数值。
   */
  public long nextIndex() {
    return counter.get();
  }

  public Set<String> reserved() {
    return Collections.unmodifiableSet(reserved);
  }
}
