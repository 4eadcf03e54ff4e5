package com.nei10u.bazi.service;

import com.nei10u.bazi.model.BirthRequest;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Fortune;
import com.nei10u.bazi.model.FortuneCycle;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.InvalidChartException;
import com.nlf.calendar.EightChar;
import com.nlf.calendar.Lunar;
import com.nlf.calendar.Solar;
import com.nlf.calendar.eightchar.DaYun;
import com.nlf.calendar.eightchar.Yun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 出生时刻 → 四柱、大运。历法换算全部交给 lunar-java，这里只做真太阳时校正和结果校验。
 */
@Service
public class ChartCalculationService {

    private static final Logger log = LoggerFactory.getLogger(ChartCalculationService.class);

    /** 北京时间基准经线 */
    private static final double BASE_LONGITUDE = 120.0;
    /** 每差 1 度，时间差 4 分钟 */
    private static final double MINUTES_PER_DEGREE = 4.0;
    /** 默认排十步大运 */
    public static final int DEFAULT_CYCLES = 10;

    public Chart calculate(BirthRequest req) {
        Gender gender = Gender.fromLabel(req.getGender());
        return toChart(eightChar(req), gender);
    }

    public Fortune fortune(BirthRequest req) {
        return fortune(req, DEFAULT_CYCLES);
    }

    /**
     * 大运。lunar-java 的第 0 步是起运前的童限，不计入。
     *
     * @param cycles 要排的大运步数
     */
    public Fortune fortune(BirthRequest req, int cycles) {
        if (cycles < 1) {
            throw new IllegalArgumentException("大运步数至少为 1: " + cycles);
        }
        Gender gender = Gender.fromLabel(req.getGender());
        EightChar eightChar = eightChar(req);

        // gender: 1男，0女
        Yun yun = eightChar.getYun(gender == Gender.MALE ? 1 : 0);
        DaYun[] daYunArr = yun.getDaYun(cycles + 1);

        List<FortuneCycle> list = new ArrayList<>(cycles);
        for (int i = 1; i < daYunArr.length; i++) {
            DaYun dy = daYunArr[i];
            list.add(new FortuneCycle(dy.getIndex(), dy.getGanZhi(), dy.getStartYear(), dy.getEndYear(),
                    dy.getStartAge(), dy.getEndAge()));
        }

        Fortune fortune = Fortune.builder()
                .chart(toChart(eightChar, gender))
                .forward(yun.isForward())
                .startYears(yun.getStartYear())
                .startMonths(yun.getStartMonth())
                .startDays(yun.getStartDay())
                .startDate(yun.getStartSolar().toYmd())
                .cycles(List.copyOf(list))
                .build();
        log.debug("fortune for {}: {} from {}", fortune.getChart(), fortune.isForward() ? "forward" : "backward",
                fortune.getStartDate());
        return fortune;
    }

    private EightChar eightChar(BirthRequest req) {
        LocalDateTime time = solarTime(req);
        Solar solar = Solar.fromYmdHms(time.getYear(), time.getMonthValue(), time.getDayOfMonth(),
                time.getHour(), time.getMinute(), 0);
        Lunar lunar = solar.getLunar();
        EightChar eightChar = lunar.getEightChar();
        // 流派 2：晚子时日柱算当天
        eightChar.setSect(2);
        log.debug("{} -> {}", solar.toYmdHms(), lunar);
        return eightChar;
    }

    private static Chart toChart(EightChar eightChar, Gender gender) {
        return Chart.of(
                eightChar.getYearGan() + eightChar.getYearZhi(),
                eightChar.getMonthGan() + eightChar.getMonthZhi(),
                eightChar.getDayGan() + eightChar.getDayZhi(),
                eightChar.getTimeGan() + eightChar.getTimeZhi(),
                gender);
    }

    /**
     * 有经度时按东经 120 度校正为当地真太阳时，否则原样返回。
     */
    LocalDateTime solarTime(BirthRequest req) {
        LocalDateTime time;
        try {
            time = LocalDateTime.of(req.getYear(), req.getMonth(), req.getDay(), req.getHour(), req.getMinute());
        } catch (DateTimeException e) {
            throw new InvalidChartException("出生时间非法: " + e.getMessage());
        }
        if (req.getLongitude() != null) {
            long offsetMinutes = (long) ((req.getLongitude() - BASE_LONGITUDE) * MINUTES_PER_DEGREE);
            time = time.plusMinutes(offsetMinutes);
        }
        return time;
    }
}
