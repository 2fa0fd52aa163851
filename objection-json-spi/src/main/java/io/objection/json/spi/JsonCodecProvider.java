package io.objection.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for a JSON library binding.
 *
 * <p>Implementations are registered in {@code META-INF/services/io.objection.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Codec for request and response documents.
     */
    JsonCodec jsonCodec();

    /**
     * Codec for dynamic path symbols.
     */
    BinaryCodec binaryCodec();
}
