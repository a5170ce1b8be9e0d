package io.github.flatfile.fixedwidth;

/**
 * One field declaration given as a command-line token.
 *
 * <p>Token grammar: {@code name=POSITION[:ALIGNMENT[:PADDING]]}, where POSITION is
 * one of
 * <ul>
 *   <li>{@code W}: a width of W code points, starting where the previous field ends;</li>
 *   <li>{@code S-E}: the code point range from S (inclusive) to E (exclusive);</li>
 *   <li>{@code S-}: a start of S, with the width inferred from the next field's start.</li>
 * </ul>
 * ALIGNMENT is {@code left} or {@code right} and PADDING is a single character.
 * For example {@code amount=30-40:right:0} declares a zero-padded, right-aligned
 * field over positions 30 to 39.
 */
public class FieldDeclarationArgument
{
    /** Record key of the field. */
    public final String name;
    /** Explicit start position, or null when only a width was given. */
    public final Integer start;
    /** Explicit width, or null when it is to be inferred. */
    public final Integer width;
    /**
     * Alignment text as given, or null to use the layout default.
     * Kept as text so an unrecognized value goes through the field-level fallback.
     */
    public final String alignmentText;
    /** Padding code point, or null to use the layout default. */
    public final Integer padding;

    /**
     * Parses a field declaration token.
     *
     * @param token The token, e.g. {@code name=0-10:right:0}.
     * @return The parsed declaration.
     * @throws IllegalArgumentException If the token does not follow the grammar.
     */
    public static FieldDeclarationArgument parse(String token)
    {
        // SPLIT THE NAME FROM THE POSITION AND OPTIONS.
        final String NAME_SEPARATOR = "=";
        int nameSeparatorIndex = token.indexOf(NAME_SEPARATOR);
        boolean hasNameSeparator = (nameSeparatorIndex > 0);
        if (!hasNameSeparator)
        {
            throw new IllegalArgumentException("Field declaration '" + token + "' must look like name=POSITION[:ALIGNMENT[:PADDING]]");
        }
        final int BEGINNING_OF_TOKEN_INDEX = 0;
        String name = token.substring(BEGINNING_OF_TOKEN_INDEX, nameSeparatorIndex).trim();
        String positionAndOptions = token.substring(nameSeparatorIndex + NAME_SEPARATOR.length());

        // SPLIT THE POSITION AND OPTIONS INTO PARTS.
        // The limit keeps a ':' padding character intact as the last part.
        final int MAXIMUM_DECLARATION_PART_COUNT = 3;
        String[] declarationParts = positionAndOptions.split(":", MAXIMUM_DECLARATION_PART_COUNT);
        final int POSITION_PART_INDEX = 0;
        final int ALIGNMENT_PART_INDEX = 1;
        final int PADDING_PART_INDEX = 2;

        // PARSE THE POSITION AS A WIDTH, A RANGE, OR AN OPEN START.
        String positionText = declarationParts[POSITION_PART_INDEX].trim();
        Integer start = null;
        Integer width = null;
        int rangeSeparatorIndex = positionText.indexOf('-');
        boolean isRangeOrStart = (rangeSeparatorIndex >= 0);
        if (isRangeOrStart)
        {
            String startText = positionText.substring(BEGINNING_OF_TOKEN_INDEX, rangeSeparatorIndex);
            String endText = positionText.substring(rangeSeparatorIndex + 1);
            start = parseNumber(token, startText);
            boolean hasEnd = !endText.isEmpty();
            if (hasEnd)
            {
                int end = parseNumber(token, endText);
                width = end - start;
            }
        }
        else
        {
            width = parseNumber(token, positionText);
        }

        // PARSE THE OPTIONAL ALIGNMENT.
        String alignmentText = null;
        boolean hasAlignmentPart = (declarationParts.length > ALIGNMENT_PART_INDEX);
        if (hasAlignmentPart)
        {
            String alignmentPart = declarationParts[ALIGNMENT_PART_INDEX];
            boolean alignmentIsGiven = !alignmentPart.isBlank();
            if (alignmentIsGiven)
            {
                alignmentText = alignmentPart;
            }
        }

        // PARSE THE OPTIONAL PADDING CHARACTER.
        // It may lie outside the Basic Multilingual Plane, so it is measured in code points.
        Integer padding = null;
        boolean hasPaddingPart = (declarationParts.length > PADDING_PART_INDEX);
        if (hasPaddingPart)
        {
            String paddingPart = declarationParts[PADDING_PART_INDEX];
            final int PADDING_LENGTH_IN_CODE_POINTS = 1;
            boolean isSingleCharacter = (paddingPart.codePointCount(BEGINNING_OF_TOKEN_INDEX, paddingPart.length()) == PADDING_LENGTH_IN_CODE_POINTS);
            if (!isSingleCharacter)
            {
                throw new IllegalArgumentException("Padding in field declaration '" + token + "' must be a single character");
            }
            padding = paddingPart.codePointAt(BEGINNING_OF_TOKEN_INDEX);
        }

        // RETURN THE PARSED DECLARATION.
        FieldDeclarationArgument fieldDeclaration = new FieldDeclarationArgument(name, start, width, alignmentText, padding);
        return fieldDeclaration;
    }

    /**
     * Creates a field declaration.
     *
     * @param name          See {@link #name}.
     * @param start         See {@link #start}.
     * @param width         See {@link #width}.
     * @param alignmentText See {@link #alignmentText}.
     * @param padding       See {@link #padding}.
     */
    public FieldDeclarationArgument(String name, Integer start, Integer width, String alignmentText, Integer padding)
    {
        this.name = name;
        this.start = start;
        this.width = width;
        this.alignmentText = alignmentText;
        this.padding = padding;
    }

    /**
     * Declares this field at the end of a layout.
     *
     * @param layoutBuilder The layout to add the field to.
     * @return The layout builder.
     */
    public LayoutBuilder appendTo(LayoutBuilder layoutBuilder)
    {
        // APPLY EACH PART OF THE DECLARATION THAT WAS GIVEN.
        FieldBuilder fieldBuilder = layoutBuilder.field(name);
        if (start != null)
        {
            fieldBuilder.position(start);
        }
        if (width != null)
        {
            fieldBuilder.width(width);
        }
        if (alignmentText != null)
        {
            fieldBuilder.alignment(alignmentText);
        }
        if (padding != null)
        {
            fieldBuilder.padding(padding);
        }
        return fieldBuilder.append();
    }

    /**
     * Parses a non-negative number from part of a token.
     *
     * @param token      The whole token, for the error message.
     * @param numberText The text to parse.
     * @return The number.
     * @throws IllegalArgumentException If the text is not a non-negative number.
     */
    private static int parseNumber(String token, String numberText)
    {
        final String NON_NEGATIVE_NUMBER_PATTERN = "\\d+";
        boolean isNumber = numberText.trim().matches(NON_NEGATIVE_NUMBER_PATTERN);
        if (!isNumber)
        {
            throw new IllegalArgumentException("'" + numberText + "' in field declaration '" + token + "' is not a position");
        }
        int number = Integer.parseInt(numberText.trim());
        return number;
    }
}
