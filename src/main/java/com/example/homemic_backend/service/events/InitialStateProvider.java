package com.example.homemic_backend.service.events;

public interface InitialStateProvider {
    InitialStateEvent snapshot();
}
