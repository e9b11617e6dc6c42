package com.wpanther.documentsigning.util;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Position of a text marker in PDF user space. {@code top} is the upper edge of the glyphs.
 */
@Data
@AllArgsConstructor
public class AnchorMatch {
    private int pageIndex;
    private float x;
    private float top;
    private float width;
    private float height;
}
