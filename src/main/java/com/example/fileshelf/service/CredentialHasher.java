package com.example.fileshelf.service;

public interface CredentialHasher {

    String hash(String plaintext);

    boolean verify(String hash, String plaintext);
}
