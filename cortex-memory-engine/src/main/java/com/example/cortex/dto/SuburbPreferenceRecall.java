package com.example.cortex.dto;

import java.util.List;

public record SuburbPreferenceRecall(String suburbName, String state, int preferenceScore, List<String> reasons) {
}
