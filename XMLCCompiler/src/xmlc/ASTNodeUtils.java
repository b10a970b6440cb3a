package xmlc;

import java.util.Optional;

/** Overloads called by the generated {@code visitChildren} methods, one per child shape. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface obj, ASTVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    return obj.map(o -> accept(o, visitor, value)).orElse(value);
  }

  private ASTNodeUtils() {}
}
