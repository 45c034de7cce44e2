package com.permit.resolution.cascade;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.store.ResolutionStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns mentions to partitions so that no entity can be reached from two partitions.
 *
 * <p>Block keys and identifiers are joined into groups: a mention joins its block
 * with each of its identifiers, and an identifier already owned by a committed
 * entity joins that entity's block. A group's partition is derived from its
 * smallest member, so the assignment does not depend on mention order.</p>
 */
final class PartitionPlanner {

    private final int partitions;
    private final Map<String, String> parent = new HashMap<>();

    PartitionPlanner(int partitions) {
        this.partitions = partitions;
    }

    List<List<NormalizedMention>> plan(Collection<NormalizedMention> mentions, ResolutionStore store) {
        Set<ContactIdentifier> looked = new HashSet<>();
        for (NormalizedMention mention : mentions) {
            String block = blockToken(mention.key().blockKey());
            for (ContactIdentifier identifier : mention.mention().getIdentifiers()) {
                String token = identifierToken(identifier);
                union(block, token);
                if (looked.add(identifier)) {
                    for (Entity owner : store.findByIdentifier(identifier)) {
                        union(token, blockToken(owner.getBlockKey()));
                    }
                }
            }
        }

        List<List<NormalizedMention>> buckets = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            buckets.add(new ArrayList<>());
        }
        for (NormalizedMention mention : mentions) {
            buckets.get(partitionOf(mention)).add(mention);
        }
        return buckets;
    }

    int partitionOf(NormalizedMention mention) {
        return Math.floorMod(find(blockToken(mention.key().blockKey())).hashCode(), partitions);
    }

    private String find(String token) {
        String root = token;
        while (parent.containsKey(root)) {
            root = parent.get(root);
        }
        String node = token;
        while (!node.equals(root)) {
            String up = parent.get(node);
            parent.put(node, root);
            node = up;
        }
        return root;
    }

    private void union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        int order = rootA.compareTo(rootB);
        if (order < 0) {
            parent.put(rootB, rootA);
        } else if (order > 0) {
            parent.put(rootA, rootB);
        }
    }

    private static String blockToken(String blockKey) {
        return "block:" + blockKey;
    }

    private static String identifierToken(ContactIdentifier identifier) {
        return "id:" + identifier;
    }
}
