package com.nosota.lingodesk.mapper;

import com.nosota.lingodesk.api.response.OrderSummaryResponse;
import com.nosota.lingodesk.api.response.ProjectUpdateResponse;
import com.nosota.lingodesk.api.response.TranslationRequestResponse;
import com.nosota.lingodesk.model.ProjectUpdate;
import com.nosota.lingodesk.model.TranslationRequest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for translation requests and their project updates.
 */
@Mapper
public interface TranslationRequestMapper {

    TranslationRequestMapper INSTANCE = Mappers.getMapper(TranslationRequestMapper.class);

    /**
     * Maps an order without its updates. Use {@link TranslationRequestResponse#withUpdates(List)}
     * to attach them.
     */
    @Mapping(target = "updates", ignore = true)
    TranslationRequestResponse toResponse(TranslationRequest request);

    List<TranslationRequestResponse> toResponseList(List<TranslationRequest> requests);

    OrderSummaryResponse toSummary(TranslationRequest request);

    List<OrderSummaryResponse> toSummaryList(List<TranslationRequest> requests);

    ProjectUpdateResponse toResponse(ProjectUpdate update);

    List<ProjectUpdateResponse> toUpdateResponseList(List<ProjectUpdate> updates);
}
