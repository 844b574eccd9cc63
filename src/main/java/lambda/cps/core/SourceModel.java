package lambda.cps.core;

import com.fasterxml.jackson.annotation.*;
import java.util.Objects;

/**
 * 源语言模型：无类型 lambda 演算，仅有变量、应用、抽象三种形式。
 *
 * <p>所有节点均为不可变值类型，按结构比较相等。{@link Atom} 是原子子集（变量与抽象），
 * 原子化转换只接受该子集，应用节点在类型层面即被排除。</p>
 */
public final class SourceModel {
  private SourceModel() {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Var.class, name = "Var"),
    @JsonSubTypes.Type(value = App.class, name = "App"),
    @JsonSubTypes.Type(value = Lam.class, name = "Lam")
  })
  public sealed interface Expr permits Atom, App {}

  /** 原子表达式：求值必然终止且无副作用。 */
  public sealed interface Atom extends Expr permits Var, Lam {}

  @JsonTypeName("Var")
  public record Var(String name) implements Atom {
    public Var {
      Objects.requireNonNull(name, "name");
    }
  }

  /** 应用 {@code fn arg}；表示本身不规定求值顺序。 */
  @JsonTypeName("App")
  public record App(Expr fn, Expr arg) implements Expr {
    public App {
      Objects.requireNonNull(fn, "fn");
      Objects.requireNonNull(arg, "arg");
    }
  }

  /** 单参数抽象 {@code λparam. body}。 */
  @JsonTypeName("Lam")
  public record Lam(String param, Expr body) implements Atom {
    public Lam {
      Objects.requireNonNull(param, "param");
      Objects.requireNonNull(body, "body");
    }
  }
}
