package work.layerflow.file;

/**
 * Whether a handle points at the current input of a code or at the file to write next.
 */
public enum FileIntent {
    READ,
    WRITE
}
