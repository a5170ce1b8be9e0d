package io.github.flatfile.fixedwidth;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Layout}: parsing lines into records and formatting
 * records into lines.
 */
class LayoutTest
{
    /** Twenty CJK characters, each a single code point that takes three bytes in UTF-8. */
    private static final String CJK_LINE = "会げク参入せうけざ次高ぶ提宝備ず開康ネフマ制員まびぶ限下びご社近め";

    // ========== PARSE TESTS ==========

    /** Verifies that a single field covering the whole line is extracted. */
    @Test
    void testParseSingleField() throws InsufficientBufferException
    {
        // PARSE A LINE THAT EXACTLY FILLS THE LAYOUT.
        Layout layout = LayoutBuilder.create().field("test").range(0, 10).append().build();
        Map<String, String> record = layout.parse("1234567890");

        // VERIFY THE RECORD HOLDS ONLY THE ONE FIELD.
        assertEquals(Map.of("test", "1234567890"), record);
    }

    /** Verifies that spacers consume positions without producing record entries. */
    @Test
    void testParseSkipsSpacer() throws InsufficientBufferException
    {
        // PARSE A LINE WHOSE FIRST HALF IS A SPACER.
        Layout layout = LayoutBuilder.create()
            .spacer(0, 5).append()
            .field("test").range(5, 10).append()
            .build();
        Map<String, String> record = layout.parse("1234567890");

        // VERIFY ONLY THE NAMED FIELD IS PRESENT.
        assertEquals(Map.of("test", "67890"), record);
    }

    /** Verifies that each field's padding is removed according to its alignment. */
    @Test
    void testParseStripsPadding() throws InsufficientBufferException
    {
        // PARSE A LINE WITH A LEFT AND A RIGHT ALIGNED FIELD.
        Layout layout = LayoutBuilder.create()
            .field("name").width(8).append()
            .field("amount").width(6).alignment(Alignment.RIGHT).padding('0').append()
            .build();
        Map<String, String> record = layout.parse("SMITH   001250");

        // VERIFY THE PADDING IS GONE FROM BOTH VALUES.
        assertEquals("SMITH", record.get("name"));
        assertEquals("1250", record.get("amount"));
    }

    /** Verifies that the record lists fields in layout order. */
    @Test
    void testParsePreservesFieldOrder() throws InsufficientBufferException
    {
        // PARSE A LINE WITH THREE FIELDS.
        Layout layout = LayoutBuilder.create()
            .field("c").width(1).append()
            .field("a").width(1).append()
            .field("b").width(1).append()
            .build();
        Map<String, String> record = layout.parse("xyz");

        // VERIFY ITERATION FOLLOWS THE LAYOUT, NOT THE NAMES.
        assertEquals(List.of("c", "a", "b"), List.copyOf(record.keySet()));
    }

    /** Verifies that when two fields share a name, the first field's value is kept. */
    @Test
    void testParseKeepsFirstValueForDuplicateName() throws InsufficientBufferException
    {
        // PARSE A LINE WITH A REPEATED FIELD NAME.
        Layout layout = LayoutBuilder.create()
            .field("code").width(3).append()
            .field("code").width(3).append()
            .build();
        Map<String, String> record = layout.parse("AAABBB");

        // VERIFY THE FIRST OCCURRENCE WINS.
        assertEquals(Map.of("code", "AAA"), record);
    }

    /** Verifies that characters beyond the layout's width are ignored. */
    @Test
    void testParseIgnoresTrailingCharacters() throws InsufficientBufferException
    {
        // PARSE A LINE LONGER THAN THE LAYOUT.
        Layout layout = LayoutBuilder.create().field("test").width(4).append().build();
        Map<String, String> record = layout.parse("1111222233334444");

        // VERIFY ONLY THE COVERED PART IS USED.
        assertEquals(Map.of("test", "1111"), record);
    }

    /** Verifies that positions between fields are skipped when parsing. */
    @Test
    void testParseSkipsGapBetweenFields() throws InsufficientBufferException
    {
        // PARSE A LINE WITH TWO UNCOVERED POSITIONS IN THE MIDDLE.
        Layout layout = LayoutBuilder.create()
            .field("first").width(3).append()
            .field("second").position(5).width(2).append()
            .build();
        Map<String, String> record = layout.parse("abc--de");

        // VERIFY THE GAP IS NOT PART OF EITHER VALUE.
        assertEquals("abc", record.get("first"));
        assertEquals("de", record.get("second"));
    }

    /** Verifies that field positions count code points, not bytes or chars. */
    @Test
    void testParseMultiByteCharacters() throws InsufficientBufferException
    {
        // PARSE A LINE OF THREE-BYTE CHARACTERS.
        Layout layout = LayoutBuilder.create()
            .spacer(0, 10).append()
            .field("test").range(10, 20).append()
            .build();
        Map<String, String> record = layout.parse(CJK_LINE);

        // VERIFY THE SECOND GROUP OF TEN CHARACTERS WAS EXTRACTED.
        assertEquals("高ぶ提宝備ず開康ネフ", record.get("test"));
    }

    /** Verifies that characters outside the BMP occupy one position each. */
    @Test
    void testParseSupplementaryCharacters() throws InsufficientBufferException
    {
        // PARSE A LINE WHOSE FIRST FIELD IS TWO EMOJI.
        final String SMILING_FACE = "😀";
        Layout layout = LayoutBuilder.create()
            .field("icons").width(2).append()
            .field("text").width(3).append()
            .build();
        Map<String, String> record = layout.parse(SMILING_FACE + SMILING_FACE + "abc");

        // VERIFY THE SECOND FIELD STARTS AFTER TWO CODE POINTS.
        assertEquals(SMILING_FACE + SMILING_FACE, record.get("icons"));
        assertEquals("abc", record.get("text"));
    }

    /** Verifies that a line shorter than the layout is rejected with both lengths. */
    @Test
    void testParseShortLineFails()
    {
        // PARSE A LINE THREE POSITIONS TOO SHORT.
        Layout layout = LayoutBuilder.create().field("test").range(0, 10).append().build();
        InsufficientBufferException exception = assertThrows(InsufficientBufferException.class, () -> layout.parse("1234567"));

        // VERIFY THE REQUIRED AND AVAILABLE LENGTHS ARE REPORTED.
        assertEquals(10, exception.getRequiredLength());
        assertEquals(7, exception.getAvailableLength());
        assertEquals("Insufficient buffer size, required 10 only 7 available", exception.getMessage());
    }

    /** Verifies that the length check counts code points, so multi-char characters do not pad a short line. */
    @Test
    void testParseShortLineOfSupplementaryCharactersFails()
    {
        // PARSE FOUR CHARS THAT ARE ONLY TWO CODE POINTS.
        Layout layout = LayoutBuilder.create().field("icons").width(3).append().build();
        InsufficientBufferException exception = assertThrows(InsufficientBufferException.class, () -> layout.parse("😀😀"));

        // VERIFY THE AVAILABLE LENGTH IS IN CODE POINTS.
        assertEquals(2, exception.getAvailableLength());
    }

    /** Verifies that an empty layout accepts any line and produces an empty record. */
    @Test
    void testParseWithEmptyLayout() throws InsufficientBufferException
    {
        // VERIFY EVEN AN EMPTY LINE IS LONG ENOUGH.
        Layout layout = LayoutBuilder.create().build();
        assertTrue(layout.parse("").isEmpty());
    }

    /** Verifies that each parse returns a new record that the caller may modify. */
    @Test
    void testParseReturnsIndependentRecords() throws InsufficientBufferException
    {
        // PARSE TWO LINES WITH THE SAME LAYOUT.
        Layout layout = LayoutBuilder.create().field("test").width(4).append().build();
        Map<String, String> firstRecord = layout.parse("1111");
        Map<String, String> secondRecord = layout.parse("2222");

        // VERIFY MODIFYING ONE RECORD DOES NOT AFFECT THE OTHER.
        firstRecord.put("extra", "value");
        assertEquals(Map.of("test", "2222"), secondRecord);
    }

    // ========== CODE POINT SOURCE TESTS ==========

    /** Verifies that a sized code point source is parsed and only the layout's width is consumed. */
    @Test
    void testParseFromSizedCodePointSource() throws InsufficientBufferException
    {
        // PARSE FROM A SOURCE LONGER THAN THE LAYOUT.
        Layout layout = LayoutBuilder.create().field("test").width(4).append().build();
        int[] codePoints = "12345".codePoints().toArray();
        Spliterator.OfInt codePointSource = Arrays.spliterator(codePoints);
        Map<String, String> record = layout.parse(codePointSource);

        // VERIFY THE RECORD AND THAT THE LAST CODE POINT WAS NOT CONSUMED.
        assertEquals(Map.of("test", "1234"), record);
        assertEquals(1, codePointSource.getExactSizeIfKnown());
    }

    /** Verifies that a sized source with too few code points is rejected before it is read. */
    @Test
    void testParseFromShortCodePointSourceFails()
    {
        // PARSE FROM A SOURCE OF THREE CODE POINTS.
        Layout layout = LayoutBuilder.create().field("test").width(4).append().build();
        Spliterator.OfInt codePointSource = Arrays.spliterator("abc".codePoints().toArray());
        InsufficientBufferException exception = assertThrows(InsufficientBufferException.class, () -> layout.parse(codePointSource));

        // VERIFY THE LENGTHS AND THAT NOTHING WAS CONSUMED.
        assertEquals(4, exception.getRequiredLength());
        assertEquals(3, exception.getAvailableLength());
        assertEquals(3, codePointSource.getExactSizeIfKnown());
    }

    /** Verifies that a source of unknown size is rejected without an available length. */
    @Test
    void testParseFromUnsizedCodePointSourceFails()
    {
        // PARSE FROM A SOURCE THAT CANNOT REPORT ITS SIZE.
        Layout layout = LayoutBuilder.create().field("test").width(4).append().build();
        final int NO_CHARACTERISTICS = 0;
        Spliterator.OfInt codePointSource = Spliterators.spliteratorUnknownSize(
            IntStream.of('a', 'b', 'c', 'd', 'e').iterator(),
            NO_CHARACTERISTICS);
        InsufficientBufferException exception = assertThrows(InsufficientBufferException.class, () -> layout.parse(codePointSource));

        // VERIFY THE AVAILABLE LENGTH IS REPORTED AS UNKNOWN.
        assertFalse(exception.hasKnownAvailableLength());
        assertNull(exception.getAvailableLength());
        assertEquals("Undefined buffer size, required 4", exception.getMessage());
    }

    // ========== FORMAT TESTS ==========

    /** Verifies that values are padded per field and the gap is filled. */
    @Test
    void testFormatTwoFields()
    {
        // FORMAT A RECORD INTO A LAYOUT WITH ONE UNCOVERED POSITION.
        Layout layout = LayoutBuilder.create()
            .field("test-1").range(0, 4).append()
            .field("test-2").range(5, 10).alignment(Alignment.RIGHT).padding('0').append()
            .build();
        Map<String, String> record = new HashMap<>();
        record.put("test-1", "ABCD");
        record.put("test-2", "1234");

        // VERIFY THE EXACT OUTPUT.
        assertEquals("ABCD 01234", layout.format(record));
    }

    /** Verifies that a left-aligned value is padded with spaces before a zero-padded right-aligned one. */
    @Test
    void testFormatAdjacentWidthFields()
    {
        // FORMAT TWO ADJACENT FIVE-WIDE FIELDS.
        Layout layout = LayoutBuilder.create()
            .field("test-1").width(5).append()
            .field("test-2").width(5).alignment(Alignment.RIGHT).padding('0').append()
            .build();
        String line = layout.format(Map.of("test-1", "ABCD", "test-2", "1234"));

        // VERIFY THE PADDING OF EACH FIELD.
        assertEquals("ABCD 01234", line);
    }

    /** Verifies that values longer than their field are truncated. */
    @Test
    void testFormatTruncatesLongValues()
    {
        // FORMAT A VALUE TWICE AS LONG AS ITS FIELD.
        Layout layout = LayoutBuilder.create().field("test").width(4).append().build();
        String line = layout.format(Map.of("test", "ABCDEFGH"));

        // VERIFY ONLY THE FIRST FOUR CHARACTERS ARE KEPT.
        assertEquals("ABCD", line);
    }

    /** Verifies that missing fields and spacers are written as padding. */
    @Test
    void testFormatMissingFieldsAndSpacers()
    {
        // FORMAT AN EMPTY RECORD.
        Layout layout = LayoutBuilder.create()
            .field("name").width(3).padding('_').append()
            .spacer(3, 5).append()
            .field("amount").width(3).alignment(Alignment.RIGHT).padding('0').append()
            .build();
        String line = layout.format(Map.of());

        // VERIFY EVERY POSITION IS PADDING.
        assertEquals("___  000", line);
        assertEquals(layout.getTotalWidth(), line.length());
    }

    /** Verifies that positions no field covers are written with the layout's default padding. */
    @Test
    void testFormatFillsGapsWithDefaultPadding()
    {
        // FORMAT A LAYOUT WITH A TWO-POSITION GAP.
        Layout layout = LayoutBuilder.create()
            .defaultPadding('.')
            .field("a").width(2).append()
            .field("b").position(4).width(2).append()
            .build();
        String line = layout.format(Map.of("a", "x", "b", "y"));

        // VERIFY THE GAP USES THE DEFAULT PADDING.
        assertEquals("x...y.", line);
    }

    /** Verifies that entries not named by the layout are ignored. */
    @Test
    void testFormatIgnoresUnknownEntries()
    {
        // FORMAT A RECORD WITH AN EXTRA ENTRY.
        Layout layout = LayoutBuilder.create().field("a").width(2).append().build();
        String line = layout.format(Map.of("a", "1", "other", "ignored"));

        // VERIFY ONLY THE DECLARED FIELD IS WRITTEN.
        assertEquals("1 ", line);
    }

    /** Verifies that multi-byte values are padded by code point. */
    @Test
    void testFormatMultiByteCharacters()
    {
        // FORMAT A FIVE-CHARACTER VALUE INTO A TEN-WIDE FIELD.
        Layout layout = LayoutBuilder.create().field("test").width(10).append().build();
        String line = layout.format(Map.of("test", "高ぶ提宝備"));

        // VERIFY FIVE PADDING CHARACTERS FOLLOW THE VALUE.
        assertEquals("高ぶ提宝備     ", line);
    }

    /** Verifies that a formatted line always has the layout's total width. */
    @Test
    void testFormattedLineHasTotalWidth()
    {
        // FORMAT RECORDS WITH SHORT, EXACT, LONG AND MISSING VALUES.
        Layout layout = LayoutBuilder.create()
            .field("a").width(3).append()
            .field("b").position(6).width(4).alignment(Alignment.RIGHT).append()
            .field("c").width(2).append()
            .build();
        List<Map<String, String>> records = List.of(
            Map.of(),
            Map.of("a", "x"),
            Map.of("a", "xyz", "b", "1234", "c", "cc"),
            Map.of("a", "much too long", "b", "also much too long", "c", "long"));

        // VERIFY EVERY LINE IS EXACTLY AS WIDE AS THE LAYOUT.
        for (Map<String, String> record : records)
        {
            String line = layout.format(record);
            assertEquals(12, line.codePointCount(0, line.length()), "Line: '" + line + "'");
        }
    }

    /** Verifies that padding outside the Basic Multilingual Plane fills each position once. */
    @Test
    void testFormatAndParseWithSupplementaryPadding() throws InsufficientBufferException
    {
        // FORMAT A SHORT VALUE WITH EMOJI PADDING AND AN EMOJI-FILLED GAP.
        final String SMILING_FACE = "😀";
        final int SMILING_FACE_CODE_POINT = SMILING_FACE.codePointAt(0);
        Layout layout = LayoutBuilder.create()
            .defaultPadding(SMILING_FACE_CODE_POINT)
            .field("code").width(4).append()
            .field("amount").position(5).width(3).alignment(Alignment.RIGHT).append()
            .build();
        String line = layout.format(Map.of("code", "ab", "amount", "7"));

        // VERIFY THE LINE IS EIGHT CODE POINTS AND PARSES BACK.
        String expectedLine = "ab" + SMILING_FACE.repeat(3) + SMILING_FACE.repeat(2) + "7";
        assertEquals(expectedLine, line);
        assertEquals(8, line.codePointCount(0, line.length()));
        assertEquals(Map.of("code", "ab", "amount", "7"), layout.parse(line));
    }

    // ========== ROUND TRIP TESTS ==========

    /** Verifies that values without edge padding survive a format and parse. */
    @Test
    void testFormatThenParseRestoresValues() throws InsufficientBufferException
    {
        // FORMAT THEN PARSE A RECORD.
        Layout layout = LayoutBuilder.create()
            .field("id").width(6).alignment(Alignment.RIGHT).padding('0').append()
            .spacer(6, 7).append()
            .field("name").width(10).append()
            .field("city").position(20).width(8).append()
            .build();
        Map<String, String> record = Map.of("id", "4217", "name", "高ぶ提宝備", "city", "Chicago");
        String line = layout.format(record);
        Map<String, String> parsedRecord = layout.parse(line);

        // VERIFY THE VALUES ARE THE SAME.
        assertEquals(record, parsedRecord);
    }

    /** Verifies that a line of the exact width survives a parse and format unchanged. */
    @Test
    void testParseThenFormatRestoresLine() throws InsufficientBufferException
    {
        // PARSE THEN FORMAT A LINE WITHOUT GAPS.
        Layout layout = LayoutBuilder.create()
            .field("id").width(4).alignment(Alignment.RIGHT).padding('0').append()
            .field("name").width(6).append()
            .build();
        String line = "0042Ada   ";
        String formattedLine = layout.format(layout.parse(line));

        // VERIFY THE LINE IS UNCHANGED.
        assertEquals(line, formattedLine);
    }
}
