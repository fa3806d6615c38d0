package com.example.slidecast_backend.repository;

import com.example.slidecast_backend.model.TaskRecord;
import com.example.slidecast_backend.util.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TaskRecordRepository extends JpaRepository<TaskRecord, String> {
    List<TaskRecord> findByOwnerIdOrderByCreatedAtDesc(String ownerId, Pageable pageable);

    List<TaskRecord> findByUploadIdOrderByCreatedAtDesc(String uploadId);

    long countByStatus(TaskStatus status);
}
