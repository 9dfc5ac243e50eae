package com.tokenwatch.indexer.dto;

/**
 * Request DTO for a simulated token transfer.
 * The private key only derives the sender address; it is never stored, logged or used to sign.
 */
public class TransferSimulationRequest {

    private String fromPk;
    private String to;
    private String amount;

    public TransferSimulationRequest() {
    }

    public TransferSimulationRequest(String fromPk, String to, String amount) {
        this.fromPk = fromPk;
        this.to = to;
        this.amount = amount;
    }

    public String getFromPk() {
        return fromPk;
    }

    public void setFromPk(String fromPk) {
        this.fromPk = fromPk;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getAmount() {
        return amount;
    }

    public void setAmount(String amount) {
        this.amount = amount;
    }

    @Override
    public String toString() {
        return "TransferSimulationRequest{" +
                "fromPk='***'" +
                ", to='" + to + '\'' +
                ", amount='" + amount + '\'' +
                '}';
    }
}
