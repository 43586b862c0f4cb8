package com.ttennebkram.batchblur.codec;

import java.io.IOException;

/**
 * Failure to decode or encode an image file.
 */
public class ImageCodecException extends IOException {

    public ImageCodecException(String message) {
        super(message);
    }

    public ImageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
