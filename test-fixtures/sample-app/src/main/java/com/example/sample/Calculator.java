package com.example.sample;

public class Calculator {

    static int add(int a, int b) {
        return a + b;
    }

    static int multiply(int a, int b) {
        return a * b;
    }

    public static int compute() {
        return add(1, multiply(2, 3));
    }

    public static int sumTo(int n) {
        int total = 0;
        for (int i = 1; i <= n; i++) {
            total = add(total, i);
        }
        return total;
    }
}
