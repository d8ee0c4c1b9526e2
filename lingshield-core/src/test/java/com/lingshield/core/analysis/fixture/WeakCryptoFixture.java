package com.lingshield.core.analysis.fixture;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

public class WeakCryptoFixture {

    public byte[] digest(byte[] data) throws NoSuchAlgorithmException {
        return MessageDigest.getInstance("MD5").digest(data);
    }

    public int roll() {
        return new Random().nextInt(6);
    }
}
