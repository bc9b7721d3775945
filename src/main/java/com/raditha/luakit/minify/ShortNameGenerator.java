package com.raditha.luakit.minify;

import com.raditha.luakit.config.LuaVocabulary;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Produces short identifiers in a fixed order: all one-character names,
 * then two-character names, then three-character names. When those run out
 * the generator continues with {@code v1}, {@code v2}, and so on.
 * <p>
 * Keywords, allow-listed globals and every name in the {@code taken} set are
 * skipped, so a generated name never collides with anything already in the
 * chunk.
 */
public class ShortNameGenerator implements Iterator<String> {

    static final String FIRST_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String REST_CHARS = FIRST_CHARS + "0123456789_";

    private static final int MAX_SHORT_LENGTH = 3;

    private final LuaVocabulary vocabulary;
    private final Set<String> taken;

    private int length = 1;
    private long index;
    private long fallback;

    public ShortNameGenerator(LuaVocabulary vocabulary, Set<String> taken) {
        this.vocabulary = vocabulary;
        this.taken = taken;
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public String next() {
        while (length <= MAX_SHORT_LENGTH) {
            long capacity = capacity(length);
            while (index < capacity) {
                String candidate = nameAt(length, index++);
                if (usable(candidate)) {
                    return candidate;
                }
            }
            length++;
            index = 0;
        }
        while (fallback < Long.MAX_VALUE) {
            String candidate = "v" + (++fallback);
            if (usable(candidate)) {
                return candidate;
            }
        }
        throw new NoSuchElementException("name space exhausted");
    }

    private boolean usable(String name) {
        return !vocabulary.isReserved(name) && !taken.contains(name);
    }

    private static long capacity(int length) {
        long count = FIRST_CHARS.length();
        for (int i = 1; i < length; i++) {
            count *= REST_CHARS.length();
        }
        return count;
    }

    /**
     * The {@code n}-th name of the given length; the last character varies
     * fastest.
     */
    static String nameAt(int length, long n) {
        char[] chars = new char[length];
        for (int i = length - 1; i > 0; i--) {
            chars[i] = REST_CHARS.charAt((int) (n % REST_CHARS.length()));
            n /= REST_CHARS.length();
        }
        chars[0] = FIRST_CHARS.charAt((int) n);
        return new String(chars);
    }
}
