package dtm.graph.core;

import dtm.graph.exceptions.DependencyGraphException;
import dtm.graph.exceptions.InvalidObjectProvideException;
import dtm.graph.storage.GraphObject;

import java.util.List;
import java.util.Optional;

/**
 * Grafo de objetos parcialmente inicializados que se liga sozinho.
 * <p>
 * Objetos são fornecidos com {@link #provide(GraphObject...)} e depois ligados com
 * {@link #populate()}, que preenche os campos anotados com {@code @Inject} reutilizando,
 * buscando ou criando objetos compatíveis.
 * <p>
 * Implementações não são thread-safe: chamadas concorrentes devem ser serializadas
 * por quem usa o grafo.
 */
public interface ObjectGraph extends ObjectGraphConfigurator {

    /**
     * Fornece objetos ao grafo. O lote é validado inteiro antes de ser aceito:
     * se algum objeto for rejeitado, nenhum objeto do lote é adicionado.
     *
     * @param objects objetos a adicionar
     * @throws InvalidObjectProvideException no primeiro objeto rejeitado
     */
    void provide(GraphObject... objects) throws InvalidObjectProvideException;

    /**
     * Liga os objetos incompletos do grafo.
     * <p>
     * A operação não é transacional: em caso de erro, as atribuições já feitas permanecem.
     *
     * @throws DependencyGraphException na primeira diretiva que não pôde ser satisfeita
     */
    void populate() throws DependencyGraphException;

    /**
     * Retorna os objetos conhecidos, primeiro os sem nome e depois os nomeados,
     * na ordem em que foram fornecidos. Objetos embutidos não são listados.
     */
    List<GraphObject> getObjects();

    Optional<GraphObject> getNamedObject(String name);
}
