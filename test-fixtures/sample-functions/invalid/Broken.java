package com.funcplan.fixture;

public class Broken {

    public int plan(int x) {
        if (x > 0 {
            return x;
        }
        return 0;
    }
}
