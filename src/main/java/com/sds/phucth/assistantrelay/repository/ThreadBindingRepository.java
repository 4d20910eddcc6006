package com.sds.phucth.assistantrelay.repository;

import com.sds.phucth.assistantrelay.models.ThreadBinding;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ThreadBindingRepository extends JpaRepository<ThreadBinding, String> {
}
