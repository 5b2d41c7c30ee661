package com.project.image.editdetection.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * 4-connected component labelling over a row-major grid of cells (pixels or blocks).
 * Flood fill runs on an explicit int stack, so arbitrarily large components cannot overflow the call stack.
 */
public final class ConnectedComponents {

    private ConnectedComponents() {}

    /**
     * One connected group of cells. Bounds are inclusive, in cell coordinates.
     * {@code cells} holds linear indices {@code row * cols + col}.
     */
    public record Component(int[] cells, int minCol, int minRow, int maxCol, int maxRow) {
        public int size() { return cells.length; }
    }

    /**
     * Finds every component of cells for which {@code changed} holds.
     * Components are returned in discovery order: a row-major scan of their first cell.
     */
    public static List<Component> find(int cols, int rows, IntPredicate changed) {
        int n = cols * rows;
        boolean[] visited = new boolean[n];
        int[] stack = new int[Math.max(n, 1)];
        int[] members = new int[Math.max(n, 1)];
        List<Component> out = new ArrayList<>();

        for (int start = 0; start < n; start++) {
            if (visited[start] || !changed.test(start)) continue;

            int top = 0, count = 0;
            int minCol = Integer.MAX_VALUE, minRow = Integer.MAX_VALUE, maxCol = -1, maxRow = -1;
            stack[top++] = start;
            visited[start] = true;

            while (top > 0) {
                int idx = stack[--top];
                members[count++] = idx;
                int col = idx % cols, row = idx / cols;
                minCol = Math.min(minCol, col);
                maxCol = Math.max(maxCol, col);
                minRow = Math.min(minRow, row);
                maxRow = Math.max(maxRow, row);

                // each cell is pushed at most once, so the stack never exceeds n
                if (col + 1 < cols) top = push(stack, top, visited, changed, idx + 1);
                if (col > 0)        top = push(stack, top, visited, changed, idx - 1);
                if (row + 1 < rows) top = push(stack, top, visited, changed, idx + cols);
                if (row > 0)        top = push(stack, top, visited, changed, idx - cols);
            }
            out.add(new Component(Arrays.copyOf(members, count), minCol, minRow, maxCol, maxRow));
        }
        return out;
    }

    private static int push(int[] stack, int top, boolean[] visited, IntPredicate changed, int idx) {
        if (!visited[idx] && changed.test(idx)) {
            visited[idx] = true;
            stack[top++] = idx;
        }
        return top;
    }
}
