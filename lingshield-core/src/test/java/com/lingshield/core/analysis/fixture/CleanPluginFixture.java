package com.lingshield.core.analysis.fixture;

/**
 * 无任何风险调用的插件类
 */
public class CleanPluginFixture {

    private final int base;

    public CleanPluginFixture(int base) {
        this.base = base;
    }

    public int add(int value) {
        return base + value;
    }

    public String greet(String name) {
        return "Hello, " + name;
    }
}
