package pl.marcinmilkowski.proof_text.filter;

/**
 * Thrown when a positional lookup asks for a word past the end of a filtered collection.
 */
public class NoWordAtIndexException extends IndexOutOfBoundsException {

    private final int index;
    private final int size;

    public NoWordAtIndexException(int index, int size) {
        super("No word at index " + index + " (" + size + " words match)");
        this.index = index;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
