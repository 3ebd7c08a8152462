package com.raditha.sentinel.model;

/**
 * An operand of an IR operation.
 * <p>
 * Two equality notions apply and must not be confused:
 * <ul>
 * <li>{@link NamedLocal} and {@link Literal} compare by value ({@code equals}).</li>
 * <li>{@link Temporary} values compare by identity: each one carries an id that is unique within
 * the {@link TemporaryArena} that produced it. Use {@link #isSameValue(Variable)} to ask whether two
 * operands are the <em>same produced value</em>; two temporaries holding equal literals are never
 * the same value.</li>
 * </ul>
 */
public sealed interface Variable permits Variable.NamedLocal, Variable.Literal, Variable.Temporary {

    /**
     * Type name as reported by the analyzer, may be empty when unknown.
     */
    String type();

    /**
     * Whether this operand is the same produced value as {@code other}.
     * Temporaries match only on their arena id; named locals match on name; literals never match
     * anything, since a literal is not a produced value.
     */
    boolean isSameValue(Variable other);

    /**
     * A user-named local variable or parameter.
     */
    record NamedLocal(String name, String type) implements Variable {
        public NamedLocal {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Local variable name cannot be empty");
            }
            type = type == null ? "" : type;
        }

        public static NamedLocal of(String name) {
            return new NamedLocal(name, "");
        }

        @Override
        public boolean isSameValue(Variable other) {
            return other instanceof NamedLocal local && local.name.equals(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A literal constant. The value is kept in its source spelling ({@code 0}, {@code true}, ...).
     */
    record Literal(String value, String type) implements Variable {
        public Literal {
            if (value == null) {
                throw new IllegalArgumentException("Literal value cannot be null");
            }
            type = type == null ? "" : type;
        }

        public static Literal of(String value) {
            return new Literal(value, "");
        }

        @Override
        public boolean isSameValue(Variable other) {
            return false;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * An anonymous result temporary. Obtain instances from {@link TemporaryArena#allocate(String)}
     * only, otherwise ids are not guaranteed unique.
     */
    record Temporary(long id, String type) implements Variable {
        public Temporary {
            type = type == null ? "" : type;
        }

        @Override
        public boolean isSameValue(Variable other) {
            return other instanceof Temporary temporary && temporary.id == id;
        }

        @Override
        public String toString() {
            return "TMP_" + id;
        }
    }
}
