package com.viffx.Slr.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Provides a two-character buffered reader for lexers, allowing single-character
 * lookahead and controlled advancement through a text stream.
 *
 * <p>This class abstracts away low-level character I/O, maintaining a rolling
 * buffer of the current and next characters. Lexers that need to observe every
 * advance (to count lines and columns, for example) subclass it and override
 * {@link #onNextChar()}.
 *
 * <p>EOF (end-of-file) is detected when the current character slot in the buffer
 * contains {@code -1}.
 */
public class LexicalCharacterBuffer implements AutoCloseable {
    // ====== INSTANCE FIELDS ====== //

    /**
     * Reader supplying characters from the source.
     */
    private final BufferedReader reader;

    /**
     * Holds the current and next character codes from the input stream.
     * <ul>
     *     <li>{@code buffer[0]} - current character</li>
     *     <li>{@code buffer[1]} - next lookahead character</li>
     * </ul>
     */
    private final int[] buffer = new int[2];

    /**
     * Characters handed back through {@link #unread(CharSequence)}, read before the reader.
     */
    private final Deque<Integer> pushedBack = new ArrayDeque<>();

    /**
     * Indicates whether the end of the input has been reached
     */
    private boolean eof;

    // ====== CONSTRUCTORS ====== //
    /**
     * Wraps the given reader for buffered lexical reading and initializes
     * the two-character buffer.
     *
     * @param source the characters being lexed
     * @throws IOException if an I/O error occurs while reading the first characters
     */
    public LexicalCharacterBuffer(Reader source) throws IOException {
        reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        // initialize the buffer
        buffer[0] = reader.read();
        buffer[1] = reader.read();

        // update EOF status
        eof = buffer[0] == -1;
    }

    public LexicalCharacterBuffer(String text) throws IOException {
        this(new StringReader(text));
    }

    // ====== PUBLIC API METHODS ====== //
    /**
     * Returns {@code true} if the end of the input has been reached.
     *
     * @return {@code true} if no more characters are available
     */
    public final boolean eof() {
        return eof;
    }

    /**
     * Returns the current character in the buffer.
     *
     * @return the current character
     */
    public final char crntChar() {
        return (char) buffer[0];
    }

    /**
     * Returns the next character in the buffer without advancing it.
     *
     * @return the next character
     */
    public final char peekChar() {
        return (char) buffer[1];
    }

    /**
     * Returns {@code true} if there is a lookahead character after the current one.
     */
    public final boolean hasPeek() {
        return buffer[1] != -1;
    }

    /**
     * Advances the buffer by one character, shifting the next lookahead
     * character into the current slot and reading a new lookahead from
     * the underlying reader.
     *
     * <p>Before the shift, this method calls {@link #onNextChar()} to allow
     * subclass-specific behavior, such as tracking line/column information.
     *
     * @return the newly current character after advancing
     * @throws IOException if the end of the input has already been reached
     */
    public final char nextChar() throws IOException {
        if (eof) throw new IOException("Reached the end of the input.");

        onNextChar();

        // shift characters
        buffer[0] = buffer[1];
        buffer[1] = read();

        // update EOF status
        eof = buffer[0] == -1;

        return crntChar();
    }

    /**
     * Puts characters back in front of the current one, so that the first of them becomes the
     * current character. {@link #onNextChar()} is not called back for them; a subclass tracking
     * positions restores its own.
     *
     * @param text characters previously read, in reading order
     */
    public final void unread(CharSequence text) {
        if (text.length() == 0) return;
        pushedBack.push(buffer[1]);
        pushedBack.push(buffer[0]);
        for (int i = text.length() - 1; i >= 0; i--) {
            pushedBack.push((int) text.charAt(i));
        }
        buffer[0] = pushedBack.pop();
        buffer[1] = pushedBack.pop();
        eof = false;
    }

    private int read() throws IOException {
        return pushedBack.isEmpty() ? reader.read() : pushedBack.pop();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    // ====== API HOOKS ====== //
    /**
     * Called immediately before advancing the buffer to the next character, while
     * {@link #crntChar()} still returns the character being left behind.
     */
    protected void onNextChar() {}

    // ====== DEBUG INFO ====== //
    /**
     * Returns a human-readable representation of the current buffer contents,
     * useful for error messages.
     *
     * @return a string showing the current and next characters in the buffer
     */
    public String buffer() {
        String[] chars = new String[2];
        for (int i = 0; i < 2; i++) {
            if (buffer[i] == -1) {
                chars[i] = "EOF";
                continue;
            }
            char c = (char) buffer[i];
            chars[i] = switch (c) {
                case '\b' -> "\\b";
                case '\t' -> "\\t";
                case '\n' -> "\\n";
                case '\f' -> "\\f";
                case '\r' -> "\\r";
                default -> String.valueOf(c);
            };
        }
        return String.format("['%s','%s']", chars[0], chars[1]);
    }
}
