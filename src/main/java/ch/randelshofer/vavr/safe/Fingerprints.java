/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.safe;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable string fingerprints of arbitrary values.
 * <p>
 * A fingerprint is the hex encoded SHA-256 digest of the value's class name
 * and its canonical JSON form. Bean properties and map keys are sorted before
 * rendering, so two values of the same class with equal JSON content have the
 * same fingerprint regardless of declaration or insertion order. Values of
 * different classes never share a fingerprint, even if they render alike
 * ({@code 1} and {@code 1L}).
 * <p>
 * Use {@link #sha256(Object)} as the key extractor of a {@link SafeSet} whose
 * element type does not implement {@code equals} and {@code hashCode}.
 */
public final class Fingerprints {
    private static final HexFormat HEX = HexFormat.of();

    private Fingerprints() {
    }

    /**
     * Returns the fingerprint of a value.
     *
     * @param value a value, may be null
     * @return 64 lower-case hex digits
     * @throws IllegalArgumentException if the value cannot be rendered as JSON
     */
    public static String sha256(Object value) {
        String text;
        if (value == null) {
            text = "null";
        } else {
            try {
                text = value.getClass().getName() + ':' + JsonSupport.CANONICAL.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("cannot fingerprint value of " + value.getClass(), e);
            }
        }
        return HEX.formatHex(digest().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
