package com.nei10u.bazi.service;

import com.nei10u.bazi.model.BirthRequest;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Fortune;
import com.nei10u.bazi.model.FortuneCycle;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.InvalidChartException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChartCalculationServiceTest {

    private final ChartCalculationService service = new ChartCalculationService();

    private static BirthRequest birth(int y, int m, int d, int h, int min, String gender, Double longitude) {
        BirthRequest req = new BirthRequest();
        req.setYear(y);
        req.setMonth(m);
        req.setDay(d);
        req.setHour(h);
        req.setMinute(min);
        req.setGender(gender);
        req.setLongitude(longitude);
        return req;
    }

    @Test
    void calculate_shouldDelegateToLunarCalendar() {
        // 2000-01-01 在小寒之前，仍属己卯年丙子月
        Chart chart = service.calculate(birth(2000, 1, 1, 12, 0, "男", null));

        assertEquals(Chart.of("己卯", "丙子", "戊午", "戊午", Gender.MALE), chart);
    }

    @Test
    void calculate_shouldShiftHourByLongitude() {
        // 东经 90 度，真太阳时早两小时，落入巳时
        Chart chart = service.calculate(birth(2000, 1, 1, 12, 0, "女", 90.0));

        assertEquals("丁巳", chart.getHour().ganZhi());
        assertEquals(Gender.FEMALE, chart.getGender());
    }

    @Test
    void solarTime_shouldApplyFourMinutesPerDegree() {
        assertEquals(LocalDateTime.of(2000, 1, 1, 11, 0),
                service.solarTime(birth(2000, 1, 1, 12, 0, "男", 105.0)));
        assertEquals(LocalDateTime.of(2000, 1, 1, 12, 0),
                service.solarTime(birth(2000, 1, 1, 12, 0, "男", 120.0)));
    }

    @Test
    void calculate_shouldRejectBadInput() {
        assertThrows(InvalidChartException.class, () -> service.calculate(birth(2000, 2, 30, 12, 0, "男", null)));
        assertThrows(InvalidChartException.class, () -> service.calculate(birth(2000, 1, 1, 12, 0, "X", null)));
    }

    @Test
    void fortune_shouldRunBackwardForYinYearMale() {
        // 己卯阴年男命逆排，自月柱丙子倒退
        Fortune fortune = service.fortune(birth(2000, 1, 1, 12, 0, "男", null));

        assertFalse(fortune.isForward());
        assertEquals("己卯", fortune.getChart().getYear().ganZhi());
        List<FortuneCycle> cycles = fortune.getCycles();
        assertEquals(ChartCalculationService.DEFAULT_CYCLES, cycles.size());
        assertEquals(List.of("乙亥", "甲戌", "癸酉"),
                cycles.subList(0, 3).stream().map(FortuneCycle::ganZhi).toList());
        assertCyclesAreContiguous(cycles, 2000);
    }

    @Test
    void fortune_shouldRunForwardForYinYearFemale() {
        Fortune fortune = service.fortune(birth(2000, 1, 1, 12, 0, "女", null), 3);

        assertTrue(fortune.isForward());
        assertEquals(List.of("丁丑", "戊寅", "己卯"),
                fortune.getCycles().stream().map(FortuneCycle::ganZhi).toList());
        assertCyclesAreContiguous(fortune.getCycles(), 2000);
    }

    @Test
    void fortune_shouldRejectNonPositiveCycleCount() {
        assertThrows(IllegalArgumentException.class, () -> service.fortune(birth(2000, 1, 1, 12, 0, "男", null), 0));
    }

    private static void assertCyclesAreContiguous(List<FortuneCycle> cycles, int birthYear) {
        FortuneCycle first = cycles.get(0);
        assertEquals(1, first.index());
        // 起运不晚于出生后十年
        assertTrue(first.startYear() >= birthYear && first.startYear() <= birthYear + 10, "start " + first.startYear());
        for (int i = 0; i < cycles.size(); i++) {
            FortuneCycle c = cycles.get(i);
            assertEquals(c.startYear() + 9, c.endYear());
            assertEquals(c.startYear() - birthYear + 1, c.startAge());
            assertEquals(c.startAge() + 9, c.endAge());
            if (i > 0) {
                assertEquals(cycles.get(i - 1).startYear() + 10, c.startYear());
            }
        }
    }
}
