package com.qrorder.kitchen.service;

import com.qrorder.kitchen.dto.KitchenOrderRef;
import com.qrorder.kitchen.dto.KitchenOrderRequest;
import com.qrorder.kitchen.entity.KitchenOrder;
import com.qrorder.kitchen.entity.KitchenOrderItem;
import com.qrorder.kitchen.entity.OrderType;
import com.qrorder.kitchen.repository.KitchenOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Stores kitchen tickets in the local database.
 *
 * <p>Order numbers read {@code ORD-yy-MM-dd-nnn}, counted per outlet per day.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class KitchenOrderService implements KitchenOrderGateway {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yy-MM-dd");

    private final KitchenOrderRepository kitchenOrderRepository;

    @Override
    @Transactional
    public KitchenOrderRef createOrder(KitchenOrderRequest request) {
        KitchenOrder order = KitchenOrder.builder()
                .orderNumber(nextOrderNumber(request.outletId(), LocalDate.now()))
                .outletId(request.outletId())
                .tableId(request.tableId())
                .sourceSessionCode(request.sessionCode())
                .orderType(OrderType.DINE_IN)
                .build();

        for (KitchenOrderRequest.Line line : request.lines()) {
            order.addItem(KitchenOrderItem.builder()
                    .productId(line.productId())
                    .variantId(line.variantId())
                    .productName(line.productName())
                    .quantity(line.quantity())
                    .modifiers(line.modifiers())
                    .notes(line.notes())
                    .build());
        }

        order = kitchenOrderRepository.save(order);
        log.info("Kitchen order created: orderNumber={}, outletId={}, items={}",
                order.getOrderNumber(), order.getOutletId(), order.getItems().size());
        return new KitchenOrderRef(order.getId(), order.getOrderNumber());
    }

    String nextOrderNumber(Long outletId, LocalDate day) {
        long todayCount = kitchenOrderRepository
                .countByOutletIdAndCreatedAtGreaterThanEqual(outletId, day.atStartOfDay());
        return "ORD-" + day.format(DAY_FORMAT) + "-" + String.format("%03d", todayCount + 1);
    }
}
