package com.phillippitts.livetranslate.testutil;

import com.phillippitts.livetranslate.exception.InvalidAudioException;
import com.phillippitts.livetranslate.service.audio.decode.ChunkDecoder;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double that treats the buffered bytes as already-decoded PCM.
 *
 * <p>{@code failing} switches to throwing {@link InvalidAudioException}. Every call's input size
 * is recorded.
 */
public class FakeChunkDecoder implements ChunkDecoder {
    public volatile boolean failing;
    public final List<Integer> decodedSizes = new CopyOnWriteArrayList<>();

    @Override
    public byte[] decode(byte[] encoded) {
        decodedSizes.add(encoded.length);
        if (failing) {
            throw new InvalidAudioException(encoded.length, "corrupt container");
        }
        return encoded.clone();
    }

    @Override
    public String name() {
        return "fake";
    }
}
