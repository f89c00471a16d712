package com.whereq.orchestra.dto;

import com.whereq.orchestra.model.Execution;
import com.whereq.orchestra.model.Job;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Records created by an execute enqueue
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteJobSubmission {

    private Job job;

    private Execution execution;
}
