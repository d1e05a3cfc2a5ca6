package com.agenthub.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MessageRequest(@JsonProperty("input") String input) {}
