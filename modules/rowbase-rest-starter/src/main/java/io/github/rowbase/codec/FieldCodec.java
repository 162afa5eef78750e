package io.github.rowbase.codec;

import io.github.rowbase.model.Cell;

/**
 * Text conversion of the cells of one logical type.
 */
public interface FieldCodec {

    /**
     * @return text of the cell, {@code null} for a null cell
     */
    String serialize(Cell cell);

    /**
     * @param text wire text, {@code null} meaning an explicit null
     * @throws io.github.rowbase.exception.SerializationException if the text is not a valid value
     */
    Cell deserialize(String text);
}
