package io.github.flatfile.fixedwidth;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Accumulates field declarations and resolves them into a {@link Layout}.
 *
 * <p>Each declaration may give a width, a start position, both (a range), or
 * only a start position, in which case its width is inferred from the start
 * position of the declaration that immediately follows it:
 * <pre>{@code
 * Layout layout = LayoutBuilder.create()
 *     .field("id").width(6).append()
 *     .spacer(6, 8).append()
 *     .field("name").position(8).append()
 *     .field("balance").position(30).width(10).alignment(Alignment.RIGHT).padding('0').append()
 *     .build();
 * }</pre>
 *
 * <p>Declarations are resolved in a single left-to-right pass by {@link #build()}.
 * A builder is meant to be used by one caller at a time; the layouts it builds
 * are immutable.
 */
public class LayoutBuilder
{
    /** Declarations in layout order. */
    private final List<FieldBuilder> declarations = new ArrayList<>();
    /** Alignment given to declarations that do not choose their own. */
    private Alignment defaultAlignment = Alignment.LEFT;
    /** Padding given to declarations that do not choose their own; also fills gaps between fields. */
    private int defaultPadding = ' ';

    /**
     * Starts a new, empty layout with LEFT alignment and space padding as defaults.
     *
     * @return A new builder.
     */
    public static LayoutBuilder create()
    {
        LayoutBuilder layoutBuilder = new LayoutBuilder();
        return layoutBuilder;
    }

    /**
     * Sets the alignment of fields declared after this call.
     *
     * @param alignment The default alignment.
     * @return This builder.
     */
    public LayoutBuilder defaultAlignment(Alignment alignment)
    {
        if (alignment == null)
        {
            throw new IllegalArgumentException("Default alignment must not be null");
        }
        this.defaultAlignment = alignment;
        return this;
    }

    /**
     * Sets the alignment of fields declared after this call from free text.
     *
     * <p>Unlike {@link FieldBuilder#alignment(String)}, an unrecognized value is
     * rejected, since a misconfigured default would silently affect every field.
     *
     * @param alignmentText "left" or "right", in any case.
     * @return This builder.
     * @throws IllegalArgumentException If the text names no alignment.
     */
    public LayoutBuilder defaultAlignment(String alignmentText)
    {
        Alignment alignment = Alignment.parse(alignmentText);
        return defaultAlignment(alignment);
    }

    /**
     * Sets the padding of fields declared after this call, and the code point
     * used to fill positions between fields when formatting.
     *
     * @param padding The default padding code point; must not be a surrogate.
     * @return This builder.
     * @throws IllegalArgumentException If {@code padding} is not a Unicode scalar value.
     */
    public LayoutBuilder defaultPadding(int padding)
    {
        this.defaultPadding = requireScalarValue(padding);
        return this;
    }

    /**
     * Starts declaring a named field.
     * The declaration joins the layout when {@link FieldBuilder#append()} or
     * {@link FieldBuilder#insert(int)} is called.
     *
     * @param name The record key of the field.
     * @return A declaration using the current default alignment and padding.
     */
    public FieldBuilder field(String name)
    {
        boolean nameIsMissing = (name == null || name.isBlank());
        if (nameIsMissing)
        {
            throw new IllegalArgumentException("Field name must not be blank; use spacer() for anonymous fields");
        }
        FieldBuilder fieldBuilder = new FieldBuilder(this, name, defaultAlignment, defaultPadding);
        return fieldBuilder;
    }

    /**
     * Starts declaring an anonymous spacer over the code point range {@code [start, end)}.
     *
     * @param start The first position of the spacer.
     * @param end   The position just past the spacer.
     * @return A declaration positioned over the range.
     */
    public FieldBuilder spacer(int start, int end)
    {
        final String NO_NAME = null;
        FieldBuilder fieldBuilder = new FieldBuilder(this, NO_NAME, defaultAlignment, defaultPadding);
        return fieldBuilder.range(start, end);
    }

    /**
     * @return The number of declarations added so far.
     */
    public int getDeclaredFieldCount()
    {
        return declarations.size();
    }

    /**
     * @return The alignment new declarations start with.
     */
    public Alignment getDefaultAlignment()
    {
        return defaultAlignment;
    }

    /**
     * @return The padding new declarations start with.
     */
    public int getDefaultPadding()
    {
        return defaultPadding;
    }

    /**
     * Resolves the declarations into an immutable layout.
     *
     * <p>Declarations are visited in order while a cursor tracks where the
     * previous field ended:
     * <ol>
     *   <li>A declaration with an explicit start may not start before the cursor.
     *       The cursor moves to that start, and if the previous field has no width
     *       yet, its width becomes the distance from its own start.</li>
     *   <li>A declaration without an explicit start starts at the cursor.</li>
     *   <li>A declaration with a width advances the cursor past itself.</li>
     * </ol>
     * A field left without a width is only valid if the very next declaration
     * carries an explicit start.
     *
     * @return The resolved layout.
     * @throws LayoutOrderingException             If a declaration starts before the previous field ends.
     * @throws MissingFieldSpecificationException If a field's width cannot be determined.
     * @throws LayoutWidthOverflowException        If a field would end past {@link Integer#MAX_VALUE}.
     */
    public Layout build()
    {
        // RESOLVE THE START AND WIDTH OF EVERY DECLARATION.
        int declarationCount = declarations.size();
        Integer[] resolvedStarts = new Integer[declarationCount];
        Integer[] resolvedWidths = new Integer[declarationCount];
        int position = 0;
        for (int fieldIndex = 0; fieldIndex < declarationCount; ++fieldIndex)
        {
            FieldBuilder declaration = declarations.get(fieldIndex);
            int previousFieldIndex = fieldIndex - 1;
            boolean hasPreviousField = (previousFieldIndex >= 0);
            boolean previousFieldIsOpen = hasPreviousField && (resolvedWidths[previousFieldIndex] == null);

            boolean hasExplicitStart = (declaration.start != null);
            if (hasExplicitStart)
            {
                // ENSURE THE FIELD DOES NOT START BEFORE THE PREVIOUS FIELD ENDS.
                int declaredStart = declaration.start;
                boolean startsBeforeCursor = (declaredStart < position);
                if (startsBeforeCursor)
                {
                    throw new LayoutOrderingException(fieldIndex, declaration.name, declaredStart, position);
                }
                position = declaredStart;

                // CLOSE THE PREVIOUS FIELD IF ITS WIDTH WAS LEFT OPEN.
                if (previousFieldIsOpen)
                {
                    int previousStart = resolvedStarts[previousFieldIndex];
                    int inferredWidth = position - previousStart;
                    boolean inferredWidthIsEmpty = (inferredWidth == 0);
                    if (inferredWidthIsEmpty)
                    {
                        // Both fields would start at the same position, leaving the open one no room.
                        int earliestAllowedStart = previousStart + 1;
                        throw new LayoutOrderingException(fieldIndex, declaration.name, declaredStart, earliestAllowedStart);
                    }
                    resolvedWidths[previousFieldIndex] = inferredWidth;
                }
            }
            else
            {
                // ENSURE AN OPEN PREVIOUS FIELD CAN STILL BE CLOSED.
                // Only an explicit start on the immediately following declaration closes it.
                if (previousFieldIsOpen)
                {
                    FieldBuilder previousDeclaration = declarations.get(previousFieldIndex);
                    throw new MissingFieldSpecificationException(
                        previousFieldIndex,
                        previousDeclaration.name,
                        "has no width and the next field has no explicit start");
                }
            }
            resolvedStarts[fieldIndex] = position;

            // ADVANCE THE CURSOR PAST A FIELD OF KNOWN WIDTH.
            boolean hasExplicitWidth = (declaration.width != null);
            if (hasExplicitWidth)
            {
                // ENSURE THE FIELD ENDS WITHIN THE LARGEST REPRESENTABLE POSITION.
                int remainingPositions = Integer.MAX_VALUE - position;
                boolean endsPastMaximumPosition = (declaration.width > remainingPositions);
                if (endsPastMaximumPosition)
                {
                    throw new LayoutWidthOverflowException(fieldIndex, declaration.name, position, declaration.width);
                }
                resolvedWidths[fieldIndex] = declaration.width;
                position += declaration.width;
            }
        }

        // ENSURE THE LAST FIELD WAS NOT LEFT OPEN.
        boolean hasFields = (declarationCount > 0);
        if (hasFields)
        {
            int lastFieldIndex = declarationCount - 1;
            boolean lastFieldIsOpen = (resolvedWidths[lastFieldIndex] == null);
            if (lastFieldIsOpen)
            {
                FieldBuilder lastDeclaration = declarations.get(lastFieldIndex);
                throw new MissingFieldSpecificationException(
                    lastFieldIndex,
                    lastDeclaration.name,
                    "is the last field and has no width");
            }
        }

        // FREEZE THE RESOLVED FIELDS INTO THE LAYOUT.
        List<Field> fields = new ArrayList<>(declarationCount);
        for (int fieldIndex = 0; fieldIndex < declarationCount; ++fieldIndex)
        {
            FieldBuilder declaration = declarations.get(fieldIndex);
            Field field = new Field(
                fieldIndex,
                declaration.name,
                resolvedStarts[fieldIndex],
                resolvedWidths[fieldIndex],
                declaration.alignment,
                declaration.padding);
            fields.add(field);
        }
        int totalWidth = position;
        Layout layout = new Layout(fields, totalWidth, defaultPadding);
        return layout;
    }

    /**
     * Checks that a padding code point is a Unicode scalar value.
     *
     * @param padding The code point to check.
     * @return The same code point.
     * @throws IllegalArgumentException If it is out of range or a surrogate.
     */
    static int requireScalarValue(int padding)
    {
        boolean isSurrogate = (padding >= Character.MIN_SURROGATE && padding <= Character.MAX_SURROGATE);
        boolean isScalarValue = Character.isValidCodePoint(padding) && !isSurrogate;
        if (!isScalarValue)
        {
            throw new IllegalArgumentException("Padding must be a Unicode scalar value, got U+" + Integer.toHexString(padding).toUpperCase(Locale.ROOT));
        }
        return padding;
    }

    /**
     * Adds a finished declaration after all others.
     *
     * @param declaration The declaration to add.
     */
    void append(FieldBuilder declaration)
    {
        declarations.add(declaration);
    }

    /**
     * Adds a finished declaration at the given index, shifting later declarations right.
     *
     * @param index       The index the declaration will have.
     * @param declaration The declaration to add.
     * @throws IndexOutOfBoundsException If the index is negative or past the end.
     */
    void insert(int index, FieldBuilder declaration)
    {
        declarations.add(index, declaration);
    }
}
