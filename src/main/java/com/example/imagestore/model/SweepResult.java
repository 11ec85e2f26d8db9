package com.example.imagestore.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SweepResult {

    List<String> paths;
    boolean dryRun;
}
