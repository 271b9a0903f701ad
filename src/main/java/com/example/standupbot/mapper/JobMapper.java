package com.example.standupbot.mapper;

import com.example.standupbot.domain.model.ScheduledJob;
import com.example.standupbot.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for exposing registered jobs through the API
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert a ScheduledJob and its bookkeeping to a JobResponse DTO
     */
    @Mapping(target = "triggerType", source = "trigger.type")
    @Mapping(target = "schedule", expression = "java(job.getTrigger().describe())")
    @Mapping(target = "lastRunAt", source = "lastRunInstant")
    JobResponse toResponse(ScheduledJob job);

    List<JobResponse> toResponseList(List<ScheduledJob> jobs);
}
