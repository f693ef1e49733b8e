package com.msgpattern.decoder;

import com.msgpattern.decoder.field.FieldDecodeException;
import com.msgpattern.decoder.schema.FieldDef;
import com.msgpattern.decoder.schema.MessagePattern;

/**
 * Callback for per-line and per-field outcomes of a {@link MessageDecoder}.
 *
 * <p>Implementations must be thread-safe if the decoder is shared.</p>
 */
public interface DecodeListener {

    DecodeListener NOOP = new DecodeListener() {};

    default void onDecoded(DecodedMessage message) {}

    default void onSkipped(int lineNumber, SkipReason reason, String detail) {}

    default void onFieldFailure(MessagePattern pattern, FieldDef field, FieldDecodeException error) {}
}
