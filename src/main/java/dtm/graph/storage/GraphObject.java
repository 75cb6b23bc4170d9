package dtm.graph.storage;

import dtm.graph.common.TypeDescriptor;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nó do grafo: envolve um valor e os metadados da resolução.
 * <p>
 * O valor continua pertencendo a quem o criou; o resolvedor apenas altera seus campos.
 * Depois do {@code populate()}, {@link #getFields()} registra qual objeto satisfez cada campo.
 */
@Getter
public class GraphObject {

    private final Object value;
    private final String name;
    private final boolean complete;

    @Setter(AccessLevel.PACKAGE)
    private TypeDescriptor typeDescriptor;

    private final boolean privateInstance;
    private final boolean created;
    private final boolean embedded;

    @Getter(AccessLevel.NONE)
    private Map<String, GraphObject> fields;

    public GraphObject(@NonNull Object value, String name, boolean complete){
        this(value, name, complete, false, false, false);
    }

    GraphObject(@NonNull Object value, String name, boolean complete, boolean privateInstance, boolean created, boolean embedded){
        this.value = value;
        this.name = (name == null) ? "" : name;
        this.complete = complete;
        this.privateInstance = privateInstance;
        this.created = created;
        this.embedded = embedded;
    }

    public static GraphObject of(@NonNull Object value){
        return new GraphObject(value, "", false);
    }

    public static GraphObject named(@NonNull String name, @NonNull Object value){
        return new GraphObject(value, name, false);
    }

    public static GraphObject completed(@NonNull Object value){
        return new GraphObject(value, "", true);
    }

    static GraphObject synthesized(@NonNull Object value, boolean privateInstance){
        return new GraphObject(value, "", false, privateInstance, true, false);
    }

    static GraphObject inlined(@NonNull Object value, boolean embedded){
        return new GraphObject(value, "", false, true, false, embedded);
    }

    public boolean isNamed(){
        return !name.isEmpty();
    }

    public Class<?> getType(){
        return (typeDescriptor != null) ? typeDescriptor.getType() : value.getClass();
    }

    /**
     * Campos preenchidos pelo resolvedor e o objeto que satisfez cada um.
     *
     * @return visão somente leitura, vazia até o objeto ser visitado
     */
    public Map<String, GraphObject> getFields(){
        return (fields == null) ? Collections.emptyMap() : Collections.unmodifiableMap(fields);
    }

    boolean hasFields(){
        return fields != null && !fields.isEmpty();
    }

    void addDependency(String field, GraphObject dependency){
        if (fields == null) {
            fields = new LinkedHashMap<>();
        }
        fields.put(field, dependency);
    }

    @Override
    public String toString() {
        String description = getType().getTypeName();
        return isNamed() ? description + " named " + name : description;
    }
}
