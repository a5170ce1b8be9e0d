package io.github.flatfile.fixedwidth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FieldDeclarationArgument}: parsing command-line field
 * declarations and applying them to a layout.
 */
class FieldDeclarationArgumentTest
{
    // ========== POSITION FORM TESTS ==========

    /** Verifies that a bare number is a width. */
    @Test
    void testParseWidth()
    {
        // VERIFY ONLY THE WIDTH IS SET.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("name=12");
        assertEquals("name", fieldDeclaration.name);
        assertNull(fieldDeclaration.start);
        assertEquals(12, fieldDeclaration.width);
        assertNull(fieldDeclaration.alignmentText);
        assertNull(fieldDeclaration.padding);
    }

    /** Verifies that START-END is a range. */
    @Test
    void testParseRange()
    {
        // VERIFY THE WIDTH IS THE LENGTH OF THE RANGE.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("amount=20-30");
        assertEquals(20, fieldDeclaration.start);
        assertEquals(10, fieldDeclaration.width);
    }

    /** Verifies that START- is a start position with an open width. */
    @Test
    void testParseOpenStart()
    {
        // VERIFY NO WIDTH IS SET.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("description=8-");
        assertEquals(8, fieldDeclaration.start);
        assertNull(fieldDeclaration.width);
    }

    // ========== OPTION TESTS ==========

    /** Verifies that alignment and padding options are read. */
    @Test
    void testParseAlignmentAndPadding()
    {
        // VERIFY BOTH OPTIONS.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("amount=6:right:0");
        assertEquals("right", fieldDeclaration.alignmentText);
        assertEquals(Integer.valueOf('0'), fieldDeclaration.padding);
    }

    /** Verifies that the alignment may be left empty while a padding is given. */
    @Test
    void testParseEmptyAlignmentWithPadding()
    {
        // VERIFY THE EMPTY ALIGNMENT IS TREATED AS ABSENT.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("code=4::*");
        assertNull(fieldDeclaration.alignmentText);
        assertEquals(Integer.valueOf('*'), fieldDeclaration.padding);
    }

    /** Verifies that a colon can itself be the padding character. */
    @Test
    void testParseColonPadding()
    {
        // VERIFY THE LAST PART IS NOT SPLIT AGAIN.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("time=5:left::");
        assertEquals("left", fieldDeclaration.alignmentText);
        assertEquals(Integer.valueOf(':'), fieldDeclaration.padding);
    }

    /** Verifies that a padding character outside the Basic Multilingual Plane counts as one character. */
    @Test
    void testParseSupplementaryPadding()
    {
        // VERIFY THE SURROGATE PAIR IS READ AS ONE CODE POINT.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("code=4:left:😀");
        assertEquals(Integer.valueOf(0x1F600), fieldDeclaration.padding);
    }

    // ========== MALFORMED DECLARATION TESTS ==========

    /**
     * Verifies that malformed declarations are rejected.
     *
     * @param token The malformed declaration.
     */
    @ParameterizedTest
    @ValueSource(strings = {
        "name",
        "=12",
        "name=",
        "name=abc",
        "name=-5",
        "name=5-x",
        "name=5:left:",
        "name=5:left:ab"})
    void testParseRejectsMalformedDeclaration(String token)
    {
        // VERIFY THE TOKEN CANNOT BE PARSED.
        assertThrows(IllegalArgumentException.class, () -> FieldDeclarationArgument.parse(token));
    }

    // ========== LAYOUT TESTS ==========

    /** Verifies that declarations build the layout they describe. */
    @Test
    void testAppendToBuildsLayout()
    {
        // APPLY THREE DECLARATIONS TO A BUILDER.
        LayoutBuilder layoutBuilder = LayoutBuilder.create();
        for (String token : List.of("id=4", "name=6-", "amount=12-18:right:0"))
        {
            FieldDeclarationArgument.parse(token).appendTo(layoutBuilder);
        }
        Layout layout = layoutBuilder.build();

        // VERIFY EVERY FIELD WAS RESOLVED AS DECLARED.
        List<Field> fields = layout.getFields();
        assertEquals(new Field(0, "id", 0, 4, Alignment.LEFT, ' '), fields.get(0));
        assertEquals(new Field(1, "name", 6, 6, Alignment.LEFT, ' '), fields.get(1));
        assertEquals(new Field(2, "amount", 12, 6, Alignment.RIGHT, '0'), fields.get(2));
        assertEquals(18, layout.getTotalWidth());
    }

    /** Verifies that a backwards range is rejected when applied. */
    @Test
    void testAppendToRejectsBackwardsRange()
    {
        // VERIFY THE EMPTY WIDTH IS REFUSED BY THE BUILDER.
        FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse("name=10-5");
        LayoutBuilder layoutBuilder = LayoutBuilder.create();
        assertThrows(IllegalArgumentException.class, () -> fieldDeclaration.appendTo(layoutBuilder));
    }
}
