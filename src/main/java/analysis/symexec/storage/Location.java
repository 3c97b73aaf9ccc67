package analysis.symexec.storage;

/**
 * Position in the source code of the analyzed program
 */
public final class Location {

    /**
     * Location used when nothing better is known
     */
    public static final Location UNKNOWN = new Location("<unknown>", -1, -1);

    private final String file;
    private final int line;
    private final int column;

    /**
     * Create a new source location
     * 
     * @param file
     *            name of the source file
     * @param line
     *            line number (starting at 1), negative if unknown
     * @param column
     *            column number (starting at 1), negative if unknown
     */
    public Location(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + column;
        result = prime * result + ((file == null) ? 0 : file.hashCode());
        result = prime * result + line;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Location other = (Location) obj;
        if (column != other.column)
            return false;
        if (line != other.line)
            return false;
        if (file == null) {
            if (other.file != null)
                return false;
        } else if (!file.equals(other.file))
            return false;
        return true;
    }

    @Override
    public String toString() {
        if (line < 0) {
            return file;
        }
        if (column < 0) {
            return file + ":" + line;
        }
        return file + ":" + line + ":" + column;
    }
}
