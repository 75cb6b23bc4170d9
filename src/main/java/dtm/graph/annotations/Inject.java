package dtm.graph.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Indica que um campo deve ser preenchido pelo grafo de objetos durante o {@code populate()}.
 *
 * O valor da anotação é a diretiva bruta que define como o campo será satisfeito:
 * <ul>
 *   <li>{@code ""} - reutiliza a instância compartilhada do tipo ou cria uma nova;</li>
 *   <li>{@code "inline"} - percorre um campo {@link Embeddable} sem injetá-lo;</li>
 *   <li>{@code "private"} - sempre cria uma instância nova, não compartilhada;</li>
 *   <li>{@code "<nome>"} ou {@code "<nome>,<opções>"} - liga o campo ao objeto nomeado.</li>
 * </ul>
 *
 * <h3>Exemplo de uso:</h3>
 * <pre>{@code
 * public class OrderService {
 *
 *     @Inject
 *     public OrderRepository repository;
 *
 *     @Inject("db")
 *     public DataSource dataSource;
 *
 *     @Inject("private")
 *     public Map<String, Order> cache;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Inject {
    /**
     * Diretiva bruta do campo.
     *
     * @return a diretiva; vazio para reutilizar ou criar a instância compartilhada
     */
    String value() default "";
}
