package io.civicledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a block for snapshots. Field names follow the report service's wire format.
 * Hashing never goes through this codec, see {@link SealEncoding}.
 */
public final class BlockCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BlockCodec(){}

    public static byte[] toBytes(Block block) {
        try {
            return MAPPER.writeValueAsBytes(toJson(block));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode block " + block.index(), e);
        }
    }

    public static Block fromBytes(byte[] bytes) {
        try {
            return fromJson(MAPPER.readTree(bytes));
        } catch (IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed block JSON", ex);
        }
    }

    public static ObjectNode toJson(Block block) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("index", block.index());
        node.put("timestamp", block.timestamp());
        node.set("data", payloadToJson(block.data()));
        node.put("previousHash", block.previousHash().hex());
        node.put("hash", block.hash().hex());
        node.put("nonce", block.nonce());
        return node;
    }

    public static Block fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("block must be a JSON object");
        }
        return new Block(
                required(node, "index").asLong(),
                required(node, "timestamp").asLong(),
                payloadFromJson(required(node, "data")),
                Digest.fromHex(required(node, "previousHash").asText()),
                Digest.fromHex(required(node, "hash").asText()),
                required(node, "nonce").asLong()
        );
    }

    static ObjectNode payloadToJson(BlockPayload p) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("reportId", p.reportId());
        data.put("category", p.category());
        data.put("urgency", p.urgency().label());
        ObjectNode loc = data.putObject("location");
        loc.put("area", p.location().area());
        loc.put("address", p.location().address());
        loc.put("nearestStation", p.location().nearestStation());
        data.put("descriptionHash", p.descriptionHash().hex());
        ArrayNode evidence = data.putArray("evidenceHashes");
        for (Digest d : p.evidenceHashes()) evidence.add(d.hex());
        data.put("identity", p.identity().label());
        p.citizenId().ifPresent(id -> data.put("citizenId", id));
        data.put("timestamp", p.timestamp());
        ArrayNode authorities = data.putArray("authorityRouted");
        for (String a : p.authorityRouted()) authorities.add(a);
        data.put("status", p.status().name());
        return data;
    }

    static BlockPayload payloadFromJson(JsonNode data) {
        JsonNode loc = required(data, "location");
        List<Digest> evidence = new ArrayList<>();
        for (JsonNode e : required(data, "evidenceHashes")) evidence.add(Digest.fromHex(e.asText()));
        List<String> authorities = new ArrayList<>();
        for (JsonNode a : required(data, "authorityRouted")) authorities.add(a.asText());
        JsonNode citizen = data.get("citizenId");

        return BlockPayload.builder()
                .reportId(required(data, "reportId").asText())
                .category(required(data, "category").asText())
                .urgency(Urgency.fromLabel(required(data, "urgency").asText()))
                .location(new Location(
                        required(loc, "area").asText(),
                        required(loc, "address").asText(),
                        required(loc, "nearestStation").asText()))
                .descriptionHash(Digest.fromHex(required(data, "descriptionHash").asText()))
                .evidenceHashes(evidence)
                .identity(Identity.fromLabel(required(data, "identity").asText()),
                        citizen == null || citizen.isNull() ? null : citizen.asText())
                .timestamp(required(data, "timestamp").asLong())
                .authorityRouted(authorities)
                .status(ReportStatus.valueOf(required(data, "status").asText()))
                .build();
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("missing field: " + field);
        return v;
    }
}
