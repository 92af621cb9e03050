package com.funcplan.fixture;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

public class OrderWorkflow {

    private final List<String> audit = new ArrayList<>();
    private int processed;

    public int plan(List<String> orders, int limit) {
        int total = 0;
        audit.clear();
        for (String order : orders) {
            if (order.isEmpty()) {
                continue;
            }
            if (total >= limit) {
                break;
            }
            try {
                total += parse(order);
                audit.add(order);
            } catch (NumberFormatException e) {
                audit.add("rejected " + order);
            } finally {
                processed++;
            }
        }
        if (total == 0) {
            throw new IllegalStateException("nothing processed");
        }
        return total;
    }

    public int classify(int x) {
        if (x > 0) {
            return 1;
        } else {
            return 2;
        }
    }

    public void repeat(int n) {
        for (int i = 0; i < n; i++) {
            doSomething(i);
        }
    }

    public String dispatch(String command) {
        String result = "none";
        switch (command) {
            case "start":
                result = "started";
                break;
            default:
                result = "unknown";
        }
        audit.add(result);
        return result;
    }

    public String firstLine(String text) throws IOException {
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            return reader.readLine();
        }
    }

    public void drain(List<String> queue) {
        while (!queue.isEmpty()) {
            String head = queue.remove(0);
            if (head.equals("stop")) {
                return;
            }
            audit.add(head);
        }
    }

    private int parse(String order) {
        return Integer.parseInt(order.trim());
    }

    private void doSomething(int i) {
        processed += i;
    }
}
