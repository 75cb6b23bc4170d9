package dtm.graph.common;

import dtm.graph.exceptions.MalformedDirectiveException;
import dtm.graph.prototypes.Directive;

import java.util.Optional;

/**
 * Interpreta o valor bruto de {@code @Inject}.
 * <p>
 * O cache por valor bruto fica no grafo; este parser não guarda estado.
 */
public final class DirectiveParser {

    private static final String INLINE = "inline";
    private static final String PRIVATE = "private";
    private static final char QUOTE = '"';

    private DirectiveParser(){
        throw new IllegalStateException("utility class");
    }

    /**
     * @param raw valor da anotação, ou {@code null} quando o campo não é anotado
     * @return a diretiva, ou vazio quando o campo não interessa ao resolvedor
     * @throws MalformedDirectiveException se o valor não resolve para um nome
     */
    public static Optional<Directive> parse(String raw) throws MalformedDirectiveException {
        if (raw == null) {
            return Optional.empty();
        }

        switch (raw) {
            case "":
                return Optional.of(Directive.PLAIN);
            case INLINE:
                return Optional.of(Directive.INLINE);
            case PRIVATE:
                return Optional.of(Directive.PRIVATE);
            default:
                return Optional.of(Directive.named(parseName(raw)));
        }
    }

    private static String parseName(String raw){
        int comma = raw.indexOf(',');
        String segment = (comma < 0 ? raw : raw.substring(0, comma)).trim();

        if (segment.isEmpty()) {
            throw new MalformedDirectiveException("Diretiva malformada '" + raw + "': nenhum nome antes do delimitador", raw);
        }

        boolean opens = segment.charAt(0) == QUOTE;
        boolean closes = segment.length() > 1 && segment.charAt(segment.length() - 1) == QUOTE;
        if (opens != closes) {
            throw new MalformedDirectiveException("Diretiva malformada '" + raw + "': aspas não fechadas", raw);
        }

        if (opens) {
            segment = segment.substring(1, segment.length() - 1).trim();
            if (segment.isEmpty()) {
                throw new MalformedDirectiveException("Diretiva malformada '" + raw + "': nome vazio entre aspas", raw);
            }
        }
        return segment;
    }
}
