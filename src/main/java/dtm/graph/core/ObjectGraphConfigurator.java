package dtm.graph.core;

/**
 * Interface para configuração do comportamento do grafo de objetos.
 */
public interface ObjectGraphConfigurator {

    /**
     * Propriedade de sistema que define o estado inicial do rastreamento de depuração.
     */
    String DEBUG_TRACE_PROPERTY = "graph.inject.debug";

    /**
     * Habilita o rastreamento, em nível DEBUG, de cada objeto fornecido e de cada campo atribuído.
     */
    void enableDebugTrace();
    /**
     * Desabilita o rastreamento de depuração.
     */
    void disableDebugTrace();

    boolean isDebugTraceEnabled();
}
