package com.nosota.lingodesk.mapper;

import com.nosota.lingodesk.api.response.CreditTransactionResponse;
import com.nosota.lingodesk.model.CreditTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface CreditTransactionMapper {

    CreditTransactionMapper INSTANCE = Mappers.getMapper(CreditTransactionMapper.class);

    CreditTransactionResponse toResponse(CreditTransaction transaction);

    List<CreditTransactionResponse> toResponseList(List<CreditTransaction> transactions);
}
