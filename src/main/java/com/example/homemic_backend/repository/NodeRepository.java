package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.Node;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NodeRepository extends JpaRepository<Node, String> {
    List<Node> findByEnabledTrueOrderByIdAsc();
}
