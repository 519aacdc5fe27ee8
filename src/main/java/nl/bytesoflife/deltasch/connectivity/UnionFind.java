package nl.bytesoflife.deltasch.connectivity;

import java.util.Arrays;

/**
 * Disjoint sets over {@code 0..n-1} with path halving and union by size.
 */
public class UnionFind {

    private int[] parent;
    private int[] size;
    private int count;

    public UnionFind() {
        parent = new int[16];
        size = new int[16];
    }

    public int add() {
        if (count == parent.length) {
            parent = Arrays.copyOf(parent, count * 2);
            size = Arrays.copyOf(size, count * 2);
        }
        parent[count] = count;
        size[count] = 1;
        return count++;
    }

    public int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    public void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) return;
        if (size[ra] < size[rb]) {
            int t = ra;
            ra = rb;
            rb = t;
        }
        parent[rb] = ra;
        size[ra] += size[rb];
    }

    public int size() {
        return count;
    }
}
