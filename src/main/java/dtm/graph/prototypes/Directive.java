package dtm.graph.prototypes;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Diretiva já interpretada de um campo anotado com {@code @Inject}.
 * <p>
 * Instâncias são imutáveis e compartilhadas entre todos os campos que declaram
 * a mesma diretiva bruta.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Directive {

    public static final Directive PLAIN = new Directive(Type.PLAIN, null);
    public static final Directive INLINE = new Directive(Type.INLINE, null);
    public static final Directive PRIVATE = new Directive(Type.PRIVATE, null);

    private final Type type;
    private final String name;

    public static Directive named(@NonNull String name){
        return new Directive(Type.NAMED, name);
    }

    public boolean isInline(){
        return type == Type.INLINE;
    }

    public boolean isPrivate(){
        return type == Type.PRIVATE;
    }

    public boolean isNamed(){
        return type == Type.NAMED;
    }

    @Override
    public String toString() {
        return isNamed() ? "named(" + name + ")" : type.name().toLowerCase();
    }

    public enum Type {
        PLAIN,
        INLINE,
        PRIVATE,
        NAMED
    }
}
