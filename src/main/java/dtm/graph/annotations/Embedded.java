package dtm.graph.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declara um campo {@link Embeddable} como base anônima do objeto dono.
 *
 * O objeto criado ao percorrer esse campo é marcado como embutido e não aparece
 * na listagem {@code getObjects()} do grafo.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Embedded {
}
