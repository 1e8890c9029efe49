package com.nosota.groupbuy.mapper;

import com.nosota.groupbuy.api.dto.ContributionDTO;
import com.nosota.groupbuy.api.dto.DiscountTierDTO;
import com.nosota.groupbuy.api.dto.NotificationDTO;
import com.nosota.groupbuy.api.dto.RewardDTO;
import com.nosota.groupbuy.api.response.OrderResponse;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.DiscountTier;
import com.nosota.groupbuy.model.NotificationLogEntry;
import com.nosota.groupbuy.model.PurchaseOrder;
import com.nosota.groupbuy.model.RewardRecord;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper between ledger entities and API DTOs.
 */
@Mapper
public interface OrderMapper {

    OrderMapper INSTANCE = Mappers.getMapper(OrderMapper.class);

    OrderResponse toResponse(PurchaseOrder order);

    ContributionDTO toDTO(Contribution contribution);

    List<ContributionDTO> toContributionDTOList(List<Contribution> contributions);

    RewardDTO toDTO(RewardRecord rewardRecord);

    List<RewardDTO> toRewardDTOList(List<RewardRecord> rewardRecords);

    NotificationDTO toDTO(NotificationLogEntry entry);

    List<NotificationDTO> toNotificationDTOList(List<NotificationLogEntry> entries);

    default DiscountTierDTO toDTO(DiscountTier tier) {
        return new DiscountTierDTO(tier.getUnitsThreshold(), tier.getDiscountBps());
    }

    default DiscountTier toDiscountTier(DiscountTierDTO dto) {
        return new DiscountTier(dto.unitsThreshold(), dto.discountBasisPoints());
    }

    List<DiscountTier> toDiscountTiers(List<DiscountTierDTO> dtos);
}
