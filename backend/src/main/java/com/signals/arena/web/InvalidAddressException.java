package com.signals.arena.web;

public class InvalidAddressException extends RuntimeException {

    public InvalidAddressException(String address) {
        super("Not a wallet address: " + address);
    }
}
