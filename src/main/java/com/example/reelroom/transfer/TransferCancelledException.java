package com.example.reelroom.transfer;

public class TransferCancelledException extends RuntimeException {

    public TransferCancelledException(String message) {
        super(message);
    }
}
