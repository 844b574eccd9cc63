package lambda.cps.core;

import com.fasterxml.jackson.annotation.*;
import java.util.List;
import java.util.Objects;

/**
 * CPS 目标模型，分为原子表达式 {@link AExpr} 与复杂表达式 {@link CExpr} 两类。
 *
 * <p>不变式：每个 {@code CExpr} 恰为一个 {@link App}（尾调用），{@code CExpr} 之间没有直接嵌套，
 * 所有嵌套都经由 {@link Lambda} 的函数体发生。</p>
 */
public final class CpsModel {
  private CpsModel() {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Lambda.class, name = "Lambda"),
    @JsonSubTypes.Type(value = Var.class, name = "Var")
  })
  public sealed interface AExpr permits Lambda, Var {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = App.class, name = "App")
  })
  public sealed interface CExpr permits App {}

  /**
   * CPS 抽象。按约定最后一个参数为续延。
   */
  @JsonTypeName("Lambda")
  public record Lambda(List<String> params, CExpr body) implements AExpr {
    public Lambda {
      params = List.copyOf(Objects.requireNonNull(params, "params"));
      if (params.isEmpty()) {
        throw new IllegalArgumentException("Lambda requires at least one parameter");
      }
      Objects.requireNonNull(body, "body");
    }
  }

  @JsonTypeName("Var")
  public record Var(String name) implements AExpr {
    public Var {
      Objects.requireNonNull(name, "name");
    }
  }

  /** 尾调用：唯一的复杂表达式形式。 */
  @JsonTypeName("App")
  public record App(AExpr callee, List<AExpr> args) implements CExpr {
    public App {
      Objects.requireNonNull(callee, "callee");
      args = List.copyOf(Objects.requireNonNull(args, "args"));
    }
  }
}
