package dtm.graph.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca uma classe cujas instâncias pertencem ao objeto que as declara, como um valor.
 *
 * Campos desse tipo nunca são compartilhados nem buscados no grafo: só podem ser
 * percorridos com a diretiva {@code @Inject("inline")}, e os campos internos do valor
 * são resolvidos na mesma passada do objeto dono.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Embeddable {
}
