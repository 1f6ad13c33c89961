package io.github.drompincen.billingrecon.gateway.controller;

import io.github.drompincen.billingrecon.protocol.api.ActivityAction;
import io.github.drompincen.billingrecon.protocol.api.ActivityPage;
import io.github.drompincen.billingrecon.runtime.activity.ActivityRecorder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/billing/activity")
public class BillingActivityController {

    private final ActivityRecorder activityRecorder;

    public BillingActivityController(ActivityRecorder activityRecorder) {
        this.activityRecorder = activityRecorder;
    }

    @GetMapping
    public ActivityPage list(@RequestParam(required = false) String companyId,
                             @RequestParam(required = false) ActivityAction action,
                             @RequestParam(required = false) String vendorId,
                             @RequestParam(required = false) String search,
                             @RequestParam(defaultValue = "0") int page,
                             @RequestParam(defaultValue = "50") int size) {
        ActivityRecorder.ActivitySlice slice = activityRecorder.page(companyId, action, vendorId, search, page, size);
        return new ActivityPage(slice.entries().stream().map(BillingDtos::toDto).collect(Collectors.toList()),
                slice.page(), slice.size(), slice.hasMore());
    }
}
