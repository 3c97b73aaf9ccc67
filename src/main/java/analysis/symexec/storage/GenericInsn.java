package analysis.symexec.storage;

/**
 * Instruction label which is either a real instruction of the analyzed program
 * or a piece of synthetic text (e.g. the label of the root frame of an
 * analysis). The set of variants is closed: {@link RealInsn} and
 * {@link TextInsn} are the only subclasses.
 */
public abstract class GenericInsn {

    /**
     * Variant tag
     */
    public enum Kind {
        REAL,
        TEXT
    }

    private GenericInsn() {
        // only the nested variants may extend this
    }

    /**
     * Label wrapping a real instruction
     * 
     * @param insn
     *            instruction
     * @return new label
     */
    public static GenericInsn real(Insn insn) {
        return new RealInsn(insn);
    }

    /**
     * Synthetic label
     * 
     * @param text
     *            text of the label
     * @return new label
     */
    public static GenericInsn text(String text) {
        return new TextInsn(text);
    }

    public abstract Kind kind();

    /**
     * Location of the labelled code
     * 
     * @return location, {@link Location#UNKNOWN} for synthetic labels
     */
    public abstract Location getLocation();

    /**
     * Independent copy of this label
     * 
     * @return copy of the same variant
     */
    public abstract GenericInsn copy();

    /**
     * Get the wrapped instruction
     * 
     * @return instruction, null for synthetic labels
     */
    public Insn getInsn() {
        return null;
    }

    /**
     * Label of a real instruction
     */
    public static final class RealInsn extends GenericInsn {

        private final Insn insn;

        RealInsn(Insn insn) {
            this.insn = insn;
        }

        @Override
        public Kind kind() {
            return Kind.REAL;
        }

        @Override
        public Location getLocation() {
            return insn.getLocation();
        }

        @Override
        public GenericInsn copy() {
            // instructions are immutable
            return new RealInsn(insn);
        }

        @Override
        public Insn getInsn() {
            return insn;
        }

        @Override
        public String toString() {
            return insn.toString();
        }
    }

    /**
     * Synthetic label
     */
    public static final class TextInsn extends GenericInsn {

        private final String text;

        TextInsn(String text) {
            this.text = text;
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public Location getLocation() {
            return Location.UNKNOWN;
        }

        @Override
        public GenericInsn copy() {
            return new TextInsn(text);
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
