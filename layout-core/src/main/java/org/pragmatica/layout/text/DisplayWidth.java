package org.pragmatica.layout.text;

/**
 * Column width of text as it appears in a monospaced editor.
 * <p>
 * Combining marks and format characters take no column, East Asian wide and fullwidth characters
 * (and most emoji) take two, everything else takes one. Surrogate pairs count as one code point.
 */
public final class DisplayWidth {
    private DisplayWidth() {}

    public static int of(CharSequence text) {
        int width = 0;
        int length = text.length();
        int i = 0;

        while (i < length) {
            int codePoint = Character.codePointAt(text, i);
            width += of(codePoint);
            i += Character.charCount(codePoint);
        }

        return width;
    }

    public static int of(int codePoint) {
        if (codePoint == 0 || isZeroWidth(codePoint)) {
            return 0;
        }
        return isWide(codePoint)
               ? 2
               : 1;
    }

    private static boolean isZeroWidth(int codePoint) {
        if (codePoint == 0x200B || codePoint == 0x200C || codePoint == 0x200D || codePoint == 0xFEFF) {
            return true;
        }

        return switch (Character.getType(codePoint)) {
            case Character.NON_SPACING_MARK, Character.ENCLOSING_MARK, Character.FORMAT -> true;
            default -> false;
        };
    }

    private static boolean isWide(int cp) {
        return (cp >= 0x1100 && cp <= 0x115F)     // Hangul Jamo
               || (cp >= 0x2E80 && cp <= 0x303E)  // CJK radicals, punctuation
               || (cp >= 0x3041 && cp <= 0x33FF)  // Hiragana .. CJK compatibility
               || (cp >= 0x3400 && cp <= 0x4DBF)  // CJK extension A
               || (cp >= 0x4E00 && cp <= 0x9FFF)  // CJK unified ideographs
               || (cp >= 0xA000 && cp <= 0xA4CF)  // Yi
               || (cp >= 0xAC00 && cp <= 0xD7A3)  // Hangul syllables
               || (cp >= 0xF900 && cp <= 0xFAFF)  // CJK compatibility ideographs
               || (cp >= 0xFE30 && cp <= 0xFE4F)  // CJK compatibility forms
               || (cp >= 0xFF00 && cp <= 0xFF60)  // Fullwidth forms
               || (cp >= 0xFFE0 && cp <= 0xFFE6)
               || (cp >= 0x1F300 && cp <= 0x1F64F) // Emoji
               || (cp >= 0x1F900 && cp <= 0x1F9FF)
               || (cp >= 0x20000 && cp <= 0x3FFFD); // CJK extensions B..
    }
}
