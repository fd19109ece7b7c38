package org.bpmntocacao.cacao;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Derives CACAO identifiers of the form {@code <prefix>--<uuid>}.
 *
 * <p>Identifiers for source nodes are name-based: SHA-256 over a fixed namespace
 * UUID followed by the UTF-8 bytes of the BPMN id, truncated to 16 bytes with the
 * version 5 and RFC 4122 variant bits set. The same BPMN id always yields the same
 * step id. Steps with no source node get a random UUID.
 */
public final class StepIdDeriver {
    public static final UUID CACAO_NAMESPACE = UUID.fromString("aa7caf3a-d55a-4e9a-b34e-056215fba56a");

    private static final String PLAYBOOK_PREFIX = "playbook";

    private StepIdDeriver() {
    }

    public static UUID deriveUuid(String sourceId) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        digest.update(ByteBuffer.allocate(16)
                .putLong(CACAO_NAMESPACE.getMostSignificantBits())
                .putLong(CACAO_NAMESPACE.getLeastSignificantBits())
                .array());
        byte[] hash = digest.digest(sourceId.getBytes(StandardCharsets.UTF_8));

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);

        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    public static String deriveStepId(String sourceId, StepKind kind, CacaoSpecVersion specVersion) {
        return format(specVersion.idPrefix(kind), deriveUuid(sourceId));
    }

    public static String randomStepId(StepKind kind, CacaoSpecVersion specVersion) {
        return format(specVersion.idPrefix(kind), UUID.randomUUID());
    }

    public static String derivePlaybookId(String processId) {
        return format(PLAYBOOK_PREFIX, deriveUuid(processId));
    }

    private static String format(String prefix, UUID uuid) {
        return prefix + "--" + uuid;
    }
}
