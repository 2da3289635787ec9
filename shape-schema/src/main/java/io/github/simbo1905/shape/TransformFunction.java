package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;

/// One direction of a [Ast.Transformation].
///
/// [Total] cannot fail for valid input. [Fallible] reports failure as a
/// [ParseResult.Failure], usually built with [ParseResult#failure(String)].
/// [Effectful] completes later and is only available to the async entry points.
/// [Composed] runs another node in the current direction and backs `compose`.
public sealed interface TransformFunction
    permits TransformFunction.Total, TransformFunction.Fallible, TransformFunction.Effectful,
    TransformFunction.Composed {

  record Total(Function<Object, Object> function) implements TransformFunction {
    public Total {
      Objects.requireNonNull(function, "function");
    }
  }

  record Fallible(Function<Object, ParseResult<Object>> function) implements TransformFunction {
    public Fallible {
      Objects.requireNonNull(function, "function");
    }
  }

  record Effectful(BiFunction<Object, CancellationToken, ? extends CompletionStage<ParseResult<Object>>> function)
      implements TransformFunction {
    public Effectful {
      Objects.requireNonNull(function, "function");
    }
  }

  record Composed(Ast through) implements TransformFunction {
    public Composed {
      Objects.requireNonNull(through, "through");
    }
  }
}
