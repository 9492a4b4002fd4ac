package com.codeoptimizer.api;

public class TestResults {
    private final int passed;
    private final int failed;

    public TestResults(int passed, int failed) {
        this.passed = passed;
        this.failed = failed;
    }

    public int getPassed() { return passed; }
    public int getFailed() { return failed; }
    public int getTotal() { return passed + failed; }

    @Override
    public String toString() {
        return passed + "/" + getTotal() + " passed";
    }
}
