package com.tony.baseballStats.model.dto;

public record HomeRunPair(String player1, String player2, long frequency) {
}
