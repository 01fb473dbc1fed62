package com.crisisalert.mapper;

import com.crisisalert.api.dto.request.CrisisAlertRequest;
import com.crisisalert.domain.model.CrisisAlertDraft;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from REST requests to alert drafts. Actions and the emergency flags are
 * not exposed over REST, so crisis alerts created through the API always carry the defaults.
 */
@Mapper
public interface AlertRequestMapper {

    @Mapping(target = "actions", ignore = true)
    @Mapping(target = "emergency", ignore = true)
    @Mapping(target = "requiresAcknowledgment", ignore = true)
    CrisisAlertDraft toDraft(CrisisAlertRequest request);
}
