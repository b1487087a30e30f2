package com.auctionhouse.api.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.HexFormat;

/**
 * Merkle tree over audit receipt hashes. A level with an odd number of
 * nodes pairs its last node with itself.
 */
public final class MerkleTree {

    private final List<String> leaves;
    private final List<List<String>> levels;

    private MerkleTree(List<String> leaves, List<List<String>> levels) {
        this.leaves = List.copyOf(leaves);
        this.levels = levels;
    }

    public static MerkleTree build(List<String> leafHashes) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new IllegalArgumentException("Cannot build Merkle tree from empty list");
        }
        List<List<String>> levels = new ArrayList<>();
        List<String> level = List.copyOf(leafHashes);
        levels.add(level);
        do {
            List<String> parents = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                parents.add(hashPair(left, right));
            }
            level = List.copyOf(parents);
            levels.add(level);
        } while (level.size() > 1);
        return new MerkleTree(leafHashes, levels);
    }

    public String getRoot() {
        return levels.get(levels.size() - 1).get(0);
    }

    public List<String> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    /**
     * Sibling hashes from the leaf at {@code leafIndex} up to the root.
     */
    public MerkleProof getProof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            throw new IndexOutOfBoundsException("Leaf index out of bounds: " + leafIndex);
        }
        List<ProofStep> steps = new ArrayList<>();
        int index = leafIndex;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<String> level = levels.get(depth);
            boolean rightChild = index % 2 == 1;
            int sibling = rightChild ? index - 1 : Math.min(index + 1, level.size() - 1);
            steps.add(new ProofStep(level.get(sibling), rightChild));
            index /= 2;
        }
        return new MerkleProof(leaves.get(leafIndex), leafIndex, List.copyOf(steps), getRoot());
    }

    public static boolean verifyProof(MerkleProof proof, String expectedRoot) {
        if (proof == null || expectedRoot == null) {
            return false;
        }
        String current = proof.leafHash();
        for (ProofStep step : proof.steps()) {
            current = step.siblingOnLeft()
                    ? hashPair(step.siblingHash(), current)
                    : hashPair(current, step.siblingHash());
        }
        return current.equals(expectedRoot);
    }

    private static String hashPair(String left, String right) {
        return sha256(left + right);
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record ProofStep(String siblingHash, boolean siblingOnLeft) {}

    public record MerkleProof(String leafHash, int leafIndex, List<ProofStep> steps, String root) {}
}
