package com.example.homemic_backend.service.Interfaces;

import com.example.homemic_backend.service.PrivacyRuleSet;

public interface PrivacyRuleSource {
    PrivacyRuleSet currentRules();
}
