package com.lingshield.core.analysis.fixture;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * 输入读取、传递与执行分散在三个方法中
 */
public class CrossMethodTaintFixture {

    public void handle(BufferedReader reader) throws IOException {
        String line = readCommand(reader);
        execute(line);
    }

    private String readCommand(BufferedReader reader) throws IOException {
        return reader.readLine();
    }

    private void execute(String command) throws IOException {
        Runtime.getRuntime().exec(command);
    }
}
