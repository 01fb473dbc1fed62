package com.crisisalert.mapper;

import com.crisisalert.domain.model.EmergencyContact;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.domain.model.QuietHours;
import com.crisisalert.entity.NotificationPreferencesEntity;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between NotificationPreferences and NotificationPreferencesEntity.
 *
 * <p>QuietHours is flattened into the three quiet_hours_* columns, and the contact
 * list goes through {@link JsonHelper}. id and audit timestamps are owned by the
 * repository adapter.
 */
@Mapper
public interface NotificationPreferencesMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(source = "quietHours.start", target = "quietHoursStart")
    @Mapping(source = "quietHours.end", target = "quietHoursEnd")
    @Mapping(source = "quietHours.enabled", target = "quietHoursEnabled")
    @Mapping(source = "emergencyContacts", target = "emergencyContacts", qualifiedByName = "contactsToJson")
    NotificationPreferencesEntity toEntity(NotificationPreferences preferences);

    @Mapping(source = "entity", target = "quietHours", qualifiedByName = "toQuietHours")
    @Mapping(source = "emergencyContacts", target = "emergencyContacts", qualifiedByName = "jsonToContacts")
    NotificationPreferences toDomain(NotificationPreferencesEntity entity);

    List<NotificationPreferences> toDomainList(List<NotificationPreferencesEntity> entities);

    @Named("toQuietHours")
    default QuietHours toQuietHours(NotificationPreferencesEntity entity) {
        if (entity.getQuietHoursStart() == null && entity.getQuietHoursEnd() == null) {
            return null;
        }
        return QuietHours.builder()
                .start(entity.getQuietHoursStart())
                .end(entity.getQuietHoursEnd())
                .enabled(entity.isQuietHoursEnabled())
                .build();
    }

    @Named("contactsToJson")
    default String contactsToJson(List<EmergencyContact> contacts) {
        return JsonHelper.toJson(contacts);
    }

    @Named("jsonToContacts")
    default List<EmergencyContact> jsonToContacts(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, EmergencyContact.class));
    }
}
