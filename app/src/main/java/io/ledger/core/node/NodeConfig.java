package io.ledger.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledger.core.txpool.TxPoolConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Simple config holder for a local node. */
public final class NodeConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public final int chainId;
    public final long blockGasLimit;
    public final long sealIntervalMillis;
    public final Map<String, Long> genesisAllocations;
    public final TxPoolConfig txPool;

    public NodeConfig(int chainId, long blockGasLimit, long sealIntervalMillis,
                      Map<String, Long> genesisAllocations, TxPoolConfig txPool) {
        if (chainId <= 0) throw new IllegalArgumentException("chainId must be > 0");
        if (blockGasLimit <= 0) throw new IllegalArgumentException("blockGasLimit must be > 0");
        if (sealIntervalMillis <= 0) throw new IllegalArgumentException("sealIntervalMillis must be > 0");
        this.chainId = chainId;
        this.blockGasLimit = blockGasLimit;
        this.sealIntervalMillis = sealIntervalMillis;
        this.genesisAllocations = genesisAllocations == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(genesisAllocations);
        this.txPool = txPool == null ? TxPoolConfig.defaults() : txPool;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                100,              // local dev chain id
                20_000_000L,      // block gas budget handed to pop()
                2_000L,           // seal every two seconds
                new LinkedHashMap<>(),
                TxPoolConfig.defaults()
        );
    }

    public NodeConfig withSealing(long sealIntervalMillis, long blockGasLimit) {
        return new NodeConfig(chainId, blockGasLimit, sealIntervalMillis, genesisAllocations, txPool);
    }

    public NodeConfig withGenesisAllocations(Map<String, Long> allocations) {
        return new NodeConfig(chainId, blockGasLimit, sealIntervalMillis, allocations, txPool);
    }

    public NodeConfig withTxPool(TxPoolConfig txPool) {
        return new NodeConfig(chainId, blockGasLimit, sealIntervalMillis, genesisAllocations, txPool);
    }

    /**
     * Reads a JSON config file. Missing fields keep their {@link #defaultLocal()} values,
     * unknown fields are ignored.
     */
    public static NodeConfig load(Path path) {
        JsonNode root;
        try {
            root = JSON.readTree(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read node config from " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Node config must be a JSON object: " + path);
        }
        return fromJson(root);
    }

    static NodeConfig fromJson(JsonNode root) {
        NodeConfig d = defaultLocal();
        Map<String, Long> alloc = new LinkedHashMap<>();
        JsonNode allocNode = root.path("genesisAllocations");
        if (allocNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = allocNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().canConvertToLong() || e.getValue().asLong() < 0) {
                    throw new IllegalArgumentException("Invalid genesis allocation for " + e.getKey());
                }
                alloc.put(e.getKey(), e.getValue().asLong());
            }
        }

        TxPoolConfig p = d.txPool;
        JsonNode poolNode = root.path("txPool");
        TxPoolConfig pool = TxPoolConfig.builder()
                .maxSlots(poolNode.path("maxSlots").asInt(p.maxSlots))
                .minGasPrice(poolNode.path("minGasPrice").asLong(p.minGasPrice))
                .staleAfterMillis(poolNode.path("staleAfterMillis").asLong(p.staleAfterMillis))
                .sweepIntervalMillis(poolNode.path("sweepIntervalMillis").asLong(p.sweepIntervalMillis))
                .includedRetention(poolNode.path("includedRetention").asInt(p.includedRetention))
                .maxPayloadBytes(poolNode.path("maxPayloadBytes").asInt(p.maxPayloadBytes))
                .build();

        return new NodeConfig(
                root.path("chainId").asInt(d.chainId),
                root.path("blockGasLimit").asLong(d.blockGasLimit),
                root.path("sealIntervalMillis").asLong(d.sealIntervalMillis),
                alloc,
                pool
        );
    }

    @Override
    public String toString() {
        return "NodeConfig{chainId=" + chainId + ", blockGasLimit=" + blockGasLimit
                + ", sealIntervalMillis=" + sealIntervalMillis
                + ", allocations=" + genesisAllocations.size() + ", " + txPool + "}";
    }
}
