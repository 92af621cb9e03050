package com.funcplan.fixture;

public class Selection {

    public int small(int a) {
        return a + 1;
    }

    public int busy(int[] values) {
        int sum = 0;
        for (int v : values) {
            if (v < 0) {
                continue;
            }
            sum += v;
        }
        return sum;
    }

    public abstract static class Shape {
        public abstract double area();
    }
}
