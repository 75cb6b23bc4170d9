package dtm.graph.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Acumula as falhas de {@code shutdown()} dos serviços; o encerramento continua
 * mesmo quando um serviço falha.
 */
public class CompositeShutdownException extends DependencyGraphException {

    private final List<Throwable> errors = new ArrayList<>();

    public CompositeShutdownException() {
        super(GraphErrorType.SERVICE_LIFECYCLE, "Falhas detectadas durante o encerramento dos serviços.");
    }

    public void addError(Throwable error) {
        if (error != null) {
            this.errors.add(error);
            this.addSuppressed(error);
        }
    }

    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int getErrorsSize() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasError(Class<? extends Throwable> type) {
        return errors.stream().anyMatch(type::isInstance);
    }

    public Throwable getFirstError() {
        if (errors.isEmpty()) return null;
        return errors.get(0);
    }

    @Override
    public String getMessage() {
        if (errors.isEmpty()) {
            return super.getMessage();
        }

        String detailedErrors = errors.stream()
                .map(e -> String.format("[%s]: %s", e.getClass().getSimpleName(), e.getMessage()))
                .collect(Collectors.joining("\n  -> "));

        return super.getMessage() + "\nErros acumulados:\n  -> " + detailedErrors;
    }

}
